package com.giftbattle.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * Places an item in a case's draw pool. Weights are relative to the other rows of the same case.
 */
@Entity
@Table(name = "case_contents")
@Getter
@Setter
@NoArgsConstructor
public class CaseContent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "case_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private LootCase lootCase;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "item_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Item item;

    @Column(nullable = false)
    private double weight;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public CaseContent(LootCase lootCase, Item item, double weight) {
        this.lootCase = lootCase;
        this.item = item;
        this.weight = weight;
    }
}
