package com.poolintelligence.scoring.exception;

import com.poolintelligence.common.exception.PoolIntelligenceException;

/** No snapshot has been ingested for the requested pool id. */
public class UnknownPoolException extends PoolIntelligenceException {

    private final String poolId;

    public UnknownPoolException(String poolId) {
        super("pool-registry", "Unknown pool " + poolId);
        this.poolId = poolId;
    }

    public String getPoolId() {
        return poolId;
    }
}
