package com.multirpg.world;

/**
 * The ten equipment slots. A player holds at most one item per slot.
 * Labels are the names used in chat text and in the record store.
 */
public enum ItemSlot {

    RING("ring"),
    AMULET("amulet"),
    CHARM("charm"),
    WEAPON("weapon"),
    HELM("helm"),
    TUNIC("tunic"),
    GLOVES("pair of gloves"),
    SHIELD("shield"),
    LEGGINGS("set of leggings"),
    BOOTS("pair of boots");

    private final String label;

    ItemSlot(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Strict parse of a store label. */
    public static ItemSlot fromLabel(String label) throws ConstraintViolationException {
        for (ItemSlot slot : values()) {
            if (slot.label.equals(label)) return slot;
        }
        throw new ConstraintViolationException("Invalid item slot: " + label);
    }
}
