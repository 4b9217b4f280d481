package com.mystery.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * Gossip a character had accumulated at one point of a game session.
 * Every store adds a row; the latest row per character is the current memory.
 */
@Entity
@Table(name = "gossip_memories", indexes = {
    @Index(name = "idx_gossip_collection_character", columnList = "collection_id, character_name")
})
public class GossipMemory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "collection_id", nullable = false)
    private String collectionId;

    @Column(name = "character_name", nullable = false)
    private String characterName;

    @Column(name = "entry_count", nullable = false)
    private Integer entryCount;

    @Column(name = "memory_text", columnDefinition = "TEXT", nullable = false)
    private String memoryText;

    @Column(name = "summary_text", columnDefinition = "TEXT")
    private String summaryText;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public GossipMemory() {
    }

    public GossipMemory(String collectionId, String characterName, int entryCount, String memoryText, String summaryText) {
        this.collectionId = collectionId;
        this.characterName = characterName;
        this.entryCount = entryCount;
        this.memoryText = memoryText;
        this.summaryText = summaryText;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getCollectionId() {
        return collectionId;
    }

    public void setCollectionId(String collectionId) {
        this.collectionId = collectionId;
    }

    public String getCharacterName() {
        return characterName;
    }

    public void setCharacterName(String characterName) {
        this.characterName = characterName;
    }

    public Integer getEntryCount() {
        return entryCount;
    }

    public void setEntryCount(Integer entryCount) {
        this.entryCount = entryCount;
    }

    public String getMemoryText() {
        return memoryText;
    }

    public void setMemoryText(String memoryText) {
        this.memoryText = memoryText;
    }

    public String getSummaryText() {
        return summaryText;
    }

    public void setSummaryText(String summaryText) {
        this.summaryText = summaryText;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
