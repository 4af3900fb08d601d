package paylink.domain.breaker;

public enum EBreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
