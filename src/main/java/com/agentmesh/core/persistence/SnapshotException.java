package com.agentmesh.core.persistence;

import com.agentmesh.core.AgentMeshException;

/**
 * A snapshot could not be written, or an existing snapshot file is unreadable or corrupt.
 */
public class SnapshotException extends AgentMeshException {

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
