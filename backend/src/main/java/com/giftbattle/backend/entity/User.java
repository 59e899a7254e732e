package com.giftbattle.backend.entity;

import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@Entity
@Table(name = "users")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "telegram_id", unique = true, nullable = false, updatable = false)
    private Long telegramId;

    private String username;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(nullable = false)
    private long balance;

    @Column(name = "total_spent", nullable = false)
    private long totalSpent;

    @Column(name = "cases_opened", nullable = false)
    private int casesOpened;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Builder
    public User(Long telegramId, String username, String firstName, String lastName, long balance) {
        this.telegramId = telegramId;
        this.username = username;
        this.firstName = firstName;
        this.lastName = lastName;
        this.balance = balance;
    }

    /**
     * Charges a case opening. Callers check funds first; the balance never goes negative.
     */
    public void chargeOpening(int price) {
        if (price < 0 || price > balance) {
            throw new IllegalStateException("cannot charge " + price + " against balance " + balance);
        }
        this.balance -= price;
        this.totalSpent += price;
        this.casesOpened += 1;
    }

    public void credit(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("credit amount must not be negative");
        }
        this.balance += amount;
    }

    @PrePersist
    public void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
