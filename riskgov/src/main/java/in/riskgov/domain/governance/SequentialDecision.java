package in.riskgov.domain.governance;

public enum SequentialDecision {
    CONTINUE,
    ACCEPT_H0,
    ACCEPT_H1;

    public boolean isTerminal() {
        return this != CONTINUE;
    }
}
