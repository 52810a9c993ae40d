package com.delangzeta.realtime.ingestion.store;

import com.delangzeta.realtime.domain.ChainCursor;
import com.delangzeta.realtime.domain.ChainCursorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads and advances per-(chain, contract) watermarks. Each cursor has a single writer (its connector),
 * so a read-compare-save is enough to keep it monotonic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainCursorService {

    private final ChainCursorRepository repository;
    private final Clock clock;

    public Optional<ChainCursor> find(String chain, String contractAddress) {
        return repository.findById(ChainCursor.idOf(chain, contractAddress));
    }

    /**
     * Moves the cursor to (block, logIndex) unless it is already at or past it.
     *
     * @return the cursor after the call
     */
    public ChainCursor advance(String chain, String contractAddress, long block, long logIndex) {
        String id = ChainCursor.idOf(chain, contractAddress);
        ChainCursor cursor = repository.findById(id).orElse(null);
        if (cursor == null) {
            cursor = new ChainCursor();
            cursor.setId(id);
            cursor.setChain(chain);
            cursor.setContractAddress(contractAddress);
        } else if (cursor.covers(block, logIndex)) {
            log.debug("Cursor {} at {}#{} ignores {}#{}", id, cursor.getLastProcessedBlock(), cursor.getLastLogIndex(), block, logIndex);
            return cursor;
        }
        cursor.setLastProcessedBlock(block);
        cursor.setLastLogIndex(logIndex);
        cursor.setUpdatedAt(Instant.now(clock));
        return repository.save(cursor);
    }
}
