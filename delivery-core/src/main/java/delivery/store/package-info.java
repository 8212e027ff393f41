/**
 * File-system backed payload queue.
 *
 * <p>{@link delivery.store.FilePayloadStore} keeps one record file per payload, named
 * {@code delivery-<resourceId>-<ULID>.json}, so that sorting a directory listing yields
 * FIFO order. Writes are temp-file-then-rename; a per-type {@code .high-water} file keeps
 * ids monotonic across restarts.
 *
 * @see delivery.store.FilePayloadStore
 * @see delivery.store.PayloadIds
 */
package delivery.store;
