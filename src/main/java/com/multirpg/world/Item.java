package com.multirpg.world;

/**
 * One piece of equipment. Owned by exactly one player, keyed by its slot.
 *
 * @param slot   equipment slot
 * @param level  combat contribution
 * @param name   unique item name, or null for generated items
 * @param unique true for the handful of named, non-generated items
 */
public record Item(ItemSlot slot, int level, String name, boolean unique) {

    public Item {
        if (slot == null) throw new IllegalArgumentException("slot");
        level = Math.max(0, level);
    }

    public static Item generated(ItemSlot slot, int level) {
        return new Item(slot, level, null, false);
    }

    /** Same slot and name, new level. */
    public Item withLevel(int newLevel) {
        return new Item(slot, newLevel, name, unique);
    }

    /** Display name: the unique name if there is one, else the slot label. */
    public String displayName() {
        return name != null ? name : slot.label();
    }
}
