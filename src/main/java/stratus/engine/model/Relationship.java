package stratus.engine.model;

/**
 * How the source resource relates to the target.
 */
public enum Relationship {
    USES("uses"),
    CONTAINS("contains"),
    REFERENCES("references"),
    PEERS_WITH("peers-with");

    private final String label;

    Relationship(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Relationship fromLabel(String label) {
        for (Relationship r : values()) {
            if (r.label.equalsIgnoreCase(label) || r.name().equalsIgnoreCase(label)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown relationship: " + label);
    }
}
