package com.scholary.tts.streamer.client;

import com.scholary.tts.streamer.protocol.PcmCodec;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AudioSink} on the default Java Sound output line.
 *
 * <p>Buffers are queued and written by one daemon thread. The clock is the line's frame position,
 * so a buffer scheduled after the end of the previous one is preceded by silence and a buffer
 * scheduled back to back plays without a gap. Discarding bumps an epoch; buffers queued under an
 * older epoch are dropped by the writer instead of played.
 *
 * <p>A buffer at a different sample rate reopens the line. The clock carries on from where the old
 * line stopped, so start times handed out before the reopen still line up after it.
 */
public class JavaSoundAudioSink implements AudioSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(JavaSoundAudioSink.class);

  /** Supplies an unopened output line for a format. */
  interface LineFactory {
    SourceDataLine create(AudioFormat format) throws LineUnavailableException;
  }

  private final BlockingQueue<ScheduledBuffer> queue = new LinkedBlockingQueue<>();
  private final AtomicLong epoch = new AtomicLong();
  private final Object lineLock = new Object();
  private final LineFactory lineFactory;
  private final Thread writer;

  private volatile boolean running = true;
  private SourceDataLine line;
  private int lineSampleRate;
  // clock time at which the current line's frame position was 0
  private double lineOrigin;
  // frames written to the current line, silence included
  private long framesWritten;

  public JavaSoundAudioSink() {
    this(
        format ->
            (SourceDataLine) AudioSystem.getLine(new DataLine.Info(SourceDataLine.class, format)));
  }

  JavaSoundAudioSink(LineFactory lineFactory) {
    this.lineFactory = lineFactory;
    this.writer = new Thread(this::writeLoop, "tts-playback");
    this.writer.setDaemon(true);
    this.writer.start();
  }

  @Override
  public double currentTime() {
    synchronized (lineLock) {
      return lineClock();
    }
  }

  @Override
  public void play(float[] samples, int sampleRate, double startTime) {
    queue.offer(new ScheduledBuffer(epoch.get(), samples, sampleRate, startTime));
  }

  @Override
  public void discardScheduled() {
    epoch.incrementAndGet();
    queue.clear();
    synchronized (lineLock) {
      if (line != null) {
        line.flush();
        framesWritten = line.getLongFramePosition();
      }
    }
  }

  @Override
  public void close() {
    running = false;
    writer.interrupt();
    try {
      writer.join(1000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    synchronized (lineLock) {
      if (line != null) {
        line.stop();
        line.close();
        line = null;
      }
    }
  }

  private void writeLoop() {
    while (running) {
      ScheduledBuffer next;
      try {
        next = queue.poll(200, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (next == null || next.epoch() != epoch.get()) {
        continue;
      }
      try {
        write(next);
      } catch (LineUnavailableException e) {
        LOGGER.error("No audio output line for {} Hz, dropping buffer", next.sampleRate(), e);
      }
    }
  }

  private void write(ScheduledBuffer buffer) throws LineUnavailableException {
    SourceDataLine output;
    long gapFrames;
    synchronized (lineLock) {
      output = ensureLine(buffer.sampleRate());
      long startFrame = Math.round((buffer.startTime() - lineOrigin) * buffer.sampleRate());
      gapFrames = Math.max(0, startFrame - framesWritten);
      framesWritten += gapFrames + buffer.samples().length;
    }
    if (gapFrames > 0) {
      byte[] silence = new byte[(int) Math.min(gapFrames, Integer.MAX_VALUE / 2) * 2];
      output.write(silence, 0, silence.length);
    }
    byte[] pcm = PcmCodec.toLittleEndianBytes(PcmCodec.requantize(buffer.samples()));
    output.write(pcm, 0, pcm.length);
  }

  /** Caller holds {@code lineLock}. */
  private SourceDataLine ensureLine(int sampleRate) throws LineUnavailableException {
    if (line != null && lineSampleRate == sampleRate) {
      return line;
    }
    double origin = lineOrigin;
    if (line != null) {
      line.drain();
      origin = lineClock();
      line.close();
      line = null;
    }
    AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
    SourceDataLine opened = lineFactory.create(format);
    opened.open(format);
    opened.start();
    line = opened;
    lineSampleRate = sampleRate;
    lineOrigin = origin;
    framesWritten = 0;
    LOGGER.info("Opened audio output line: sampleRate={}, clock={}s", sampleRate, origin);
    return opened;
  }

  /** Caller holds {@code lineLock}. */
  private double lineClock() {
    if (line == null) {
      return lineOrigin;
    }
    return lineOrigin + (double) line.getLongFramePosition() / lineSampleRate;
  }

  private record ScheduledBuffer(long epoch, float[] samples, int sampleRate, double startTime) {}
}
