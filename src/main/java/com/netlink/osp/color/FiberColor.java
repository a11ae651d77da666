package com.netlink.osp.color;

/**
 * TIA-598 fiber color sequence.
 * <p>
 * The same 12-entry table codes both buffer tubes and the fibers inside a
 * tube. Declaration order is the sequence order; {@link #ordinal()} 0 is
 * position 1.
 */
public enum FiberColor {
    BLUE("Blue", "#0066CC", "#FFFFFF"),
    ORANGE("Orange", "#FF6600", "#FFFFFF"),
    GREEN("Green", "#00AA00", "#FFFFFF"),
    BROWN("Brown", "#8B4513", "#FFFFFF"),
    SLATE("Slate", "#708090", "#FFFFFF"),
    WHITE("White", "#FFFFFF", "#000000"),
    RED("Red", "#CC0000", "#FFFFFF"),
    BLACK("Black", "#1A1A1A", "#FFFFFF"),
    YELLOW("Yellow", "#FFCC00", "#000000"),
    VIOLET("Violet", "#8800AA", "#FFFFFF"),
    ROSE("Rose", "#FF69B4", "#000000"),
    AQUA("Aqua", "#00CCCC", "#000000");

    /** Number of entries in the sequence; also the fiber count of one tube. */
    public static final int SEQUENCE_LENGTH = 12;

    private static final FiberColor[] SEQUENCE = values();

    private final String displayName;
    private final String hex;
    private final String textColor;

    FiberColor(String displayName, String hex, String textColor) {
        this.displayName = displayName;
        this.hex = hex;
        this.textColor = textColor;
    }

    public String displayName() {
        return displayName;
    }

    public String hex() {
        return hex;
    }

    /** Label color that stays readable on top of {@link #hex()}. */
    public String textColor() {
        return textColor;
    }

    /**
     * Color for a 1-based sequence position. Positions past 12 wrap around.
     *
     * @throws IllegalArgumentException if {@code position < 1}
     */
    public static FiberColor forPosition(int position) {
        if (position < 1)
            throw new IllegalArgumentException("Color position must be >= 1: " + position);
        return SEQUENCE[(position - 1) % SEQUENCE_LENGTH];
    }

    public static FiberColor fromName(String name) {
        for (FiberColor c : SEQUENCE) {
            if (c.displayName.equalsIgnoreCase(name) || c.name().equalsIgnoreCase(name))
                return c;
        }
        throw new IllegalArgumentException("Unknown fiber color: " + name);
    }
}
