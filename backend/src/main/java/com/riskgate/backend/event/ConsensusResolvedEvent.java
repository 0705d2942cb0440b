package com.riskgate.backend.event;

import com.riskgate.backend.model.ConsensusResult;

public record ConsensusResolvedEvent(ConsensusResult result) {
}
