package com.mystery.repository;

import com.mystery.entity.GossipMemory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GossipMemoryRepository extends JpaRepository<GossipMemory, Long> {
    Optional<GossipMemory> findFirstByCollectionIdAndCharacterNameOrderByIdDesc(String collectionId, String characterName);
}
