package com.lendrisk.custody;

import com.lendrisk.model.TransferRecordDocument;
import com.lendrisk.repo.TransferRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerAssetCustodyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private TransferRecordRepository repo;

    @Test
    @DisplayName("stores the whole batch with one saveAll")
    @SuppressWarnings("unchecked")
    void savesBatch() {
        LedgerAssetCustody custody = new LedgerAssetCustody(repo, Clock.fixed(NOW, ZoneOffset.UTC));

        custody.execute("op-1", "liquidate", List.of(
                new TransferInstruction("USDC", new BigDecimal("750"), "user:liq", "pool:USDC"),
                new TransferInstruction("ETH", new BigDecimal("0.46"), "collateral:ETH", "user:liq")));

        ArgumentCaptor<List<TransferRecordDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(repo, times(1)).saveAll(captor.capture());
        List<TransferRecordDocument> docs = captor.getValue();
        assertEquals(2, docs.size());
        assertTrue(docs.stream().allMatch(d -> d.getOperationId().equals("op-1") && d.getTs().equals(NOW)));
        assertEquals("collateral:ETH", docs.get(1).getFrom());
        assertEquals("liquidate", docs.get(0).getOperation());
    }

    @Test
    @DisplayName("an empty batch does not touch the store")
    void emptyBatch() {
        LedgerAssetCustody custody = new LedgerAssetCustody(repo, Clock.fixed(NOW, ZoneOffset.UTC));
        custody.execute("op-2", "add-collateral", List.of());
        verifyNoInteractions(repo);
    }

    @Test
    @DisplayName("store failures propagate so the operation aborts")
    void failurePropagates() {
        when(repo.saveAll(anyList())).thenThrow(new IllegalStateException("mongo down"));
        LedgerAssetCustody custody = new LedgerAssetCustody(repo, Clock.fixed(NOW, ZoneOffset.UTC));
        assertThrows(IllegalStateException.class, () -> custody.execute("op-3", "deposit",
                List.of(new TransferInstruction("USDC", BigDecimal.ONE, "user:u", "pool:USDC"))));
    }
}
