package domain.item;

/**
 * Item rarity as labelled in the item tables. Labels match member names exactly.
 * {@link #Unset} is the zero member returned when a label is blank or unknown.
 */
public enum Rarity {
    Unset,
    Common,
    Uncommon,
    Rare,
    Epic,
    Legendary
}
