package dtm.registry.prototypes;

public enum RegistrationState {
    UNCONSTRUCTED,
    CONSTRUCTING,
    CONSTRUCTED,
    FAILED
}
