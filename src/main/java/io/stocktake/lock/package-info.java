/**
 * In-process item locks. Locks are never persisted; a restart releases all of them.
 */
package io.stocktake.lock;
