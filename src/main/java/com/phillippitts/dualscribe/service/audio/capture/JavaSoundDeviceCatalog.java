package com.phillippitts.dualscribe.service.audio.capture;

import com.phillippitts.dualscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.dualscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Device enumeration backed by Java Sound mixers.
 *
 * <p>A mixer is listed when it supports a {@link TargetDataLine} in the canonical format.
 * It is classified as loopback when its name or description contains one of the configured hints
 * (for example "BlackHole" on macOS or "Stereo Mix" on Windows).
 */
public class JavaSoundDeviceCatalog implements AudioDeviceCatalog {

    private static final Logger LOG = LogManager.getLogger(JavaSoundDeviceCatalog.class);

    private final List<String> loopbackHints;

    public JavaSoundDeviceCatalog(AudioCaptureProperties props) {
        this.loopbackHints = Objects.requireNonNull(props).getLoopbackHints();
    }

    @Override
    public List<AudioDevice> enumerate() {
        DataLine.Info lineInfo = new DataLine.Info(TargetDataLine.class, AudioFormat.javaSoundFormat());
        List<AudioDevice> devices = new ArrayList<>();
        for (Mixer.Info info : AudioSystem.getMixerInfo()) {
            try {
                Mixer mixer = AudioSystem.getMixer(info);
                if (!mixer.isLineSupported(lineInfo)) {
                    continue;
                }
                String label = info.getDescription() == null || info.getDescription().isBlank()
                        ? info.getName()
                        : info.getName() + " (" + info.getDescription() + ")";
                devices.add(new AudioDevice(info.getName(), label,
                        classify(info.getName() + ' ' + info.getDescription(), loopbackHints)));
            } catch (RuntimeException e) {
                LOG.debug("Skipping mixer {}: {}", info.getName(), e.toString());
            }
        }
        LOG.debug("Enumerated {} capture devices", devices.size());
        return devices;
    }

    // Package-private for tests
    static AudioDeviceKind classify(String name, List<String> hints) {
        if (name == null) {
            return AudioDeviceKind.INPUT;
        }
        String n = name.toLowerCase(Locale.ROOT);
        for (String hint : hints) {
            if (!hint.isBlank() && n.contains(hint)) {
                return AudioDeviceKind.LOOPBACK;
            }
        }
        return AudioDeviceKind.INPUT;
    }
}
