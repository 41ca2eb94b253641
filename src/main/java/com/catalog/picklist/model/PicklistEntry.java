package com.catalog.picklist.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Row of the database-backed vocabulary. Used only when {@code app.picklist.storage.mode=database}.
 */
@Setter
@Getter
@Entity
@Table(name = "picklist_entries",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_picklist_entries_type_item",
                columnNames = {"picklist_type", "item_id"}))
public class PicklistEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "picklist_type", nullable = false, length = 16)
    private PicklistType picklistType;

    @Column(name = "item_id", nullable = false)
    private String itemId;

    @Column(name = "item_name", nullable = false, columnDefinition = "TEXT")
    private String itemName;

    @Column(name = "department")
    private String department;

    @Column(name = "family")
    private String family;

    // Preserves collection order, which decides ties during matching.
    @Column(name = "sort_order", nullable = false)
    private int position;

    public PicklistEntry() {
    }

    public static PicklistEntry from(PicklistType type, PicklistItem item, int position) {
        PicklistEntry entry = new PicklistEntry();
        entry.setPicklistType(type);
        entry.setItemId(item.id());
        entry.setItemName(item.name());
        if (item instanceof Category category) {
            entry.setDepartment(category.department());
            entry.setFamily(category.family());
        }
        entry.setPosition(position);
        return entry;
    }

    public PicklistItem toItem() {
        return switch (picklistType) {
            case BRAND -> new Brand(itemId, itemName);
            case CATEGORY -> new Category(itemId, itemName, department, family);
            case STYLE -> new Style(itemId, itemName);
            case ATTRIBUTE -> new Attribute(itemId, itemName);
        };
    }
}
