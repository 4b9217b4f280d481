package com.mystery.service;

import com.mystery.case_model.RelationshipType;
import com.mystery.entity.GossipMemory;
import com.mystery.gossip.GossipEntry;
import com.mystery.gossip.GossipMemoryException;
import com.mystery.gossip.MemorySummary;
import com.mystery.repository.GossipMemoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class JpaGossipMemoryServiceTest {

    private static final List<GossipEntry> HEARD = List.of(
        new GossipEntry("James", "They asked me where I was at ten.", RelationshipType.CLOSE_FRIEND));

    @Mock
    private GossipMemoryRepository repository;

    private JpaGossipMemoryService memory;

    @BeforeEach
    public void setUp() {
        memory = new JpaGossipMemoryService(repository, "mystery-g1");
    }

    @Test
    public void storeSavesTextAndDigest() {
        when(repository.save(any(GossipMemory.class))).thenAnswer(invocation -> {
            GossipMemory saved = invocation.getArgument(0);
            saved.setId(7L);
            return saved;
        });

        assertEquals("mystery-g1-7", memory.store("Lisa", HEARD));

        ArgumentCaptor<GossipMemory> row = ArgumentCaptor.forClass(GossipMemory.class);
        verify(repository).save(row.capture());
        assertEquals("mystery-g1", row.getValue().getCollectionId());
        assertEquals("Lisa", row.getValue().getCharacterName());
        assertEquals(Integer.valueOf(1), row.getValue().getEntryCount());
        assertTrue(row.getValue().getMemoryText().contains("From James (Close Friend):"));
        assertTrue(row.getValue().getSummaryText().startsWith("Lisa has heard 1 piece of gossip"));
    }

    @Test
    public void summaryIsTheLatestRow() {
        GossipMemory row = new GossipMemory("mystery-g1", "Lisa", 2, "text", "Lisa has heard 2 pieces of gossip.");
        row.setId(12L);
        when(repository.findFirstByCollectionIdAndCharacterNameOrderByIdDesc("mystery-g1", "Lisa"))
            .thenReturn(Optional.of(row));

        MemorySummary summary = memory.summarize("Lisa").orElseThrow();

        assertEquals("mystery-g1-12", summary.getHandle());
        assertEquals("Lisa has heard 2 pieces of gossip.", summary.getSummaryText().orElseThrow());
    }

    @Test
    public void nothingStoredYet() {
        when(repository.findFirstByCollectionIdAndCharacterNameOrderByIdDesc("mystery-g1", "Nick"))
            .thenReturn(Optional.empty());

        assertTrue(memory.summarize("Nick").isEmpty());
    }

    @Test
    public void emptyGossipIsRejected() {
        assertThrows(GossipMemoryException.class, () -> memory.store("Lisa", List.of()));
        verifyNoInteractions(repository);
    }

    @Test
    public void databaseFailuresBecomeMemoryExceptions() {
        when(repository.save(any(GossipMemory.class))).thenThrow(new DataAccessResourceFailureException("db down"));
        when(repository.findFirstByCollectionIdAndCharacterNameOrderByIdDesc(any(), any()))
            .thenThrow(new DataAccessResourceFailureException("db down"));

        GossipMemoryException stored = assertThrows(GossipMemoryException.class, () -> memory.store("Lisa", HEARD));
        assertTrue(stored.getMessage().contains("db down"));
        assertThrows(GossipMemoryException.class, () -> memory.summarize("Lisa"));
    }
}
