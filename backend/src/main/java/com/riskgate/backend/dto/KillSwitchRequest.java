package com.riskgate.backend.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KillSwitchRequest {

    @NotNull
    private Action action;

    private String reason;

    public enum Action {
        ACTIVATE, DEACTIVATE;

        @JsonCreator
        public static Action from(String value) {
            if (value == null) {
                throw new IllegalArgumentException("action is required");
            }
            return Action.valueOf(value.trim().toUpperCase());
        }
    }
}
