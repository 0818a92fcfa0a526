// src/main/java/org/evalux/landlord/model/Player.java
package org.evalux.landlord.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "player", uniqueConstraints = @UniqueConstraint(columnNames = "name"))
public class Player {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 60)
    private String name;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public Player() {}

    public Player(String name) {
        this.name = name;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
