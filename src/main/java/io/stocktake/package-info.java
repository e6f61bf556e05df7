/**
 * Stock take session coordination engine.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.stocktake.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.stocktake.cli.StockTakeCommand} maps commands to coordinator calls.</li>
 *   <li>{@code io.stocktake.runtime.SessionCoordinator} composes locks, ledger, progress and lifecycle.</li>
 *   <li>{@code io.stocktake.storage.SqliteStockTakeStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.stocktake;
