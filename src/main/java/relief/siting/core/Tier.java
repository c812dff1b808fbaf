package relief.siting.core;

public enum Tier {
    DEPOT("depot"),
    DISTRIBUTION("dist");

    private final String idPrefix;

    Tier(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String facilityId(String anchorCellId) {
        return idPrefix + "-" + anchorCellId;
    }
}
