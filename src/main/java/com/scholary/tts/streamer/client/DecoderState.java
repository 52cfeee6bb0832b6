package com.scholary.tts.streamer.client;

/**
 * Lifecycle of one {@link StreamDecoder}.
 *
 * <ul>
 *   <li>AWAITING_HEADER: nothing played yet; watching for a header or an early error marker
 *   <li>STREAMING: header read, PCM is being scheduled as it arrives
 *   <li>TERMINATED: the stream was finished or rejected; no further input is accepted
 * </ul>
 */
public enum DecoderState {
  AWAITING_HEADER,
  STREAMING,
  TERMINATED
}
