package com.riskgate.backend.model;

public record SymbolStats(int wins, int losses, double totalPnl) {

    public static final SymbolStats EMPTY = new SymbolStats(0, 0, 0.0);

    public int totalTrades() {
        return wins + losses;
    }

    public double winRate() {
        int total = totalTrades();
        return total == 0 ? 0.0 : (double) wins / total;
    }

    public SymbolStats record(double pnl) {
        return pnl > 0
                ? new SymbolStats(wins + 1, losses, totalPnl + pnl)
                : new SymbolStats(wins, losses + 1, totalPnl + pnl);
    }
}
