package me.golemcore.reminder.adapter.outbound.voice;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

/**
 * Plays raw 16-bit signed little-endian mono PCM on the default output line.
 * Blocks until playback has drained.
 */
@Component
@Slf4j
public class PcmAudioPlayer {

    private static final int SAMPLE_SIZE_BITS = 16;

    public void play(byte[] pcm, int sampleRate) {
        AudioFormat format = new AudioFormat(sampleRate, SAMPLE_SIZE_BITS, 1, true, false);
        try (SourceDataLine line = AudioSystem.getSourceDataLine(format)) {
            line.open(format);
            line.start();
            line.write(pcm, 0, pcm.length);
            line.drain();
            log.debug("[Audio] Played {} bytes at {} Hz", pcm.length, sampleRate);
        } catch (LineUnavailableException | IllegalArgumentException e) {
            throw new IllegalStateException("Audio output unavailable: " + e.getMessage(), e);
        }
    }
}
