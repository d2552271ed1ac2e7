package com.multirpg.sim;

import com.multirpg.world.ItemSlot;
import com.multirpg.world.QuestState;

import java.util.List;
import java.util.Map;

/**
 * Static game content: unique items, quest texts and the flavor lines of
 * calamities and godsends. Tags are substituted with {@code %s}.
 */
public final class ContentTables {

    private ContentTables() { }

    /**
     * A named item that can drop instead of a generated one.
     *
     * @param minLevel      lowest item level, inclusive
     * @param maxLevel      highest item level, exclusive
     * @param requiredLevel player level needed to find it
     * @param flavor        second sentence of the find notice
     */
    public record UniqueItem(String name, ItemSlot slot, int minLevel, int maxLevel,
                             int requiredLevel, String flavor) {

        public String findMessage(int level) {
            return "The light of the gods shines down! You found the level " + level + " "
                + name + "! " + flavor;
        }
    }

    public static final List<UniqueItem> UNIQUE_ITEMS = List.of(
        new UniqueItem("Mattt's Omniscience Grand Crown", ItemSlot.HELM, 50, 74, 25,
            "Your enemies fall before you as you anticipate their every move."),
        new UniqueItem("Juliet's Glorious Ring of Sparkliness", ItemSlot.RING, 50, 74, 25,
            "Your enemies are blinded by its glory and their greed."),
        new UniqueItem("Res0's Protectorate Plate Mail", ItemSlot.TUNIC, 75, 99, 30,
            "Your enemies cower as their attacks have no effect."),
        new UniqueItem("Dwyn's Storm Magic Amulet", ItemSlot.AMULET, 100, 124, 35,
            "Your enemies are swept away by elemental fury."),
        new UniqueItem("Jotun's Fury Colossal Sword", ItemSlot.WEAPON, 150, 174, 40,
            "Your enemies are crushed by the blow."),
        new UniqueItem("Drdink's Cane of Blind Rage", ItemSlot.WEAPON, 175, 200, 45,
            "You blindly swing, hitting stuff."),
        new UniqueItem("Mrquick's Magical Boots of Swiftness", ItemSlot.BOOTS, 250, 300, 48,
            "Your enemies choke on your dust."),
        new UniqueItem("Jeff's Cluehammer of Doom", ItemSlot.WEAPON, 300, 350, 52,
            "Your enemies gain sudden clarity... as you relieve them of it.")
    );

    public record QuestTemplate(QuestState.Type type, String text) { }

    public static final List<QuestTemplate> QUESTS = List.of(
        new QuestTemplate(QuestState.Type.TIME, "slay the dragon terrorising the realm"),
        new QuestTemplate(QuestState.Type.TIME, "retrieve the sacred chalice from the dark temple"),
        new QuestTemplate(QuestState.Type.TIME, "escort the princess safely across the mountains"),
        new QuestTemplate(QuestState.Type.GRID, "cleanse the Temple of the Shadow God"),
        new QuestTemplate(QuestState.Type.GRID, "recover the Lost Tome of Forbidden Knowledge")
    );

    /** Slots a calamity or godsend can change, with the line naming the cause. */
    public static final Map<ItemSlot, String> CALAMITY_ITEM_LINES = Map.of(
        ItemSlot.AMULET, "%s fell, chipping their amulet",
        ItemSlot.CHARM, "%s dropped their charm in a bog",
        ItemSlot.WEAPON, "%s left their weapon out in the rain",
        ItemSlot.TUNIC, "%s spilled a shrinking potion on their tunic",
        ItemSlot.SHIELD, "%s's shield was scorched by dragon fire",
        ItemSlot.LEGGINGS, "%s burned a hole in their leggings while ironing"
    );

    public static final Map<ItemSlot, String> GODSEND_ITEM_LINES = Map.of(
        ItemSlot.AMULET, "%s's amulet was blessed by a cleric",
        ItemSlot.CHARM, "%s's charm absorbed a bolt of lightning",
        ItemSlot.WEAPON, "%s sharpened their weapon",
        ItemSlot.TUNIC, "A magician cast Rigidity on %s's tunic",
        ItemSlot.SHIELD, "%s reinforced their shield with dragon scales",
        ItemSlot.LEGGINGS, "A wizard imbued %s's leggings with Fortitude"
    );

    /** Slot order for the item-changing branch, so a seeded roll picks the same slot every run. */
    public static final List<ItemSlot> CHANGEABLE_SLOTS = List.of(
        ItemSlot.AMULET, ItemSlot.CHARM, ItemSlot.WEAPON,
        ItemSlot.TUNIC, ItemSlot.SHIELD, ItemSlot.LEGGINGS);

    public static final List<String> CALAMITY_LINES = List.of(
        "%s tripped over their own feet",
        "%s was startled by a loud noise",
        "%s drank a potion of Extreme Clumsiness by mistake",
        "%s got lost in the Enchanted Woods"
    );

    public static final List<String> GODSEND_LINES = List.of(
        "%s found a four-leaf clover",
        "%s received a blessing from a wandering priest",
        "%s stumbled upon an enchanted spring",
        "%s was touched by an angel"
    );
}
