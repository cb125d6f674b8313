package com.justtrades.exception;

import com.justtrades.domain.model.PositionKey;

/**
 * The fill log for a position cannot be replayed. Fatal for that symbol.
 */
public class LedgerCorruptionException extends BaseException {

    public LedgerCorruptionException(PositionKey key, String problem) {
        super(
                ErrorCode.LEDGER_CORRUPTION,
                "Fill log for " + key + " is corrupt: " + problem,
                positionDetails(key));
    }
}
