/**
 * Wire protocol between storage clients and the single-writer daemon.
 *
 * <h2>Framing</h2>
 *
 * <pre>
 * ┌──────────────────────┬──────────────────────────────┐
 * │ length (u32, LE)     │ UTF-8 JSON body              │
 * │ 4 bytes              │ exactly {@code length} bytes │
 * └──────────────────────┴──────────────────────────────┘
 * </pre>
 *
 * A clean end of stream before the first header byte means the peer left.
 * Anything shorter than announced is a {@link ProtocolException}.
 *
 * <h2>Messages</h2>
 * Requests carry a {@code type} discriminator ({@code ExecBatch},
 * {@code PrepareForMaintenance}, {@code CloseDatabase},
 * {@code ReopenDatabase}, {@code Ping}, {@code Shutdown},
 * {@code Disconnect}). Responses carry {@code status} ({@code ok} or
 * {@code error}), a {@code rev} request counter and operation-specific
 * fields. Unknown response fields are ignored; an unknown status is not.
 *
 * <h2>Versioning</h2>
 * Compatibility is decided by the channel name ({@code <namespace>-v1}),
 * not by anything inside a message. A client speaking another version
 * simply finds no daemon listening.
 */
package de.bsommerfeld.gridkeeper.protocol;
