package com.giftbattle.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

@Entity
@Table(name = "inventory_entries")
@Getter
@NoArgsConstructor
public class InventoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "item_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Item item;

    // survives deletion of the case it came from
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_case_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private LootCase sourceCase;

    @Column(name = "is_sold", nullable = false)
    private boolean sold;

    @Column(name = "sold_price")
    private Integer soldPrice;

    @Column(name = "sold_at")
    private LocalDateTime soldAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public InventoryEntry(User user, Item item, LootCase sourceCase) {
        this.user = user;
        this.item = item;
        this.sourceCase = sourceCase;
    }

    public void markSold(int price) {
        if (sold) {
            throw new IllegalStateException("inventory entry " + id + " is already sold");
        }
        this.sold = true;
        this.soldPrice = price;
        this.soldAt = LocalDateTime.now();
    }

    @PrePersist
    public void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
