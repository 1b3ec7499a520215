package com.sprout.database.session;

/**
 * Point-in-time view of the connection pool.
 *
 * @param active connections currently checked out
 * @param idle connections waiting in the pool
 * @param total live connections (active plus idle)
 * @param awaiting threads blocked waiting for a connection
 * @param openHandles handles issued by the session manager and not yet released
 */
public record PoolSnapshot(int active, int idle, int total, int awaiting, int openHandles) {}
