package com.nightscan.output;

import com.nightscan.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fans one notification out to every configured channel. A failing channel does not stop the others.
 */
public final class CompositeNotifier implements PipelineNotifier {
    private static final Logger LOG = LogManager.getLogger(CompositeNotifier.class);

    private final List<PipelineNotifier> channels;

    public CompositeNotifier(List<PipelineNotifier> channels) {
        this.channels = List.copyOf(channels);
    }

    /**
     * Channels from {@code notify.channels}: {@code log} and/or {@code mail}. Unknown names are logged and skipped.
     */
    public static CompositeNotifier fromConfig(Config config) {
        List<PipelineNotifier> channels = new ArrayList<>();
        for (String raw : config.getList("notify.channels")) {
            String name = raw.trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case "log":
                    channels.add(new LogNotifier());
                    break;
                case "mail":
                case "email":
                    channels.add(new MailNotifier(new Mailer(), Mailer.loadSettings(config)));
                    break;
                default:
                    LOG.warn("Unknown notify channel ignored: {}", raw);
                    break;
            }
        }
        if (channels.isEmpty()) {
            channels.add(new LogNotifier());
        }
        return new CompositeNotifier(channels);
    }

    public int size() {
        return channels.size();
    }

    @Override
    public void sendSuccess(JSONObject progressDocument, Path reportPath) {
        RuntimeException first = null;
        for (PipelineNotifier channel : channels) {
            try {
                channel.sendSuccess(progressDocument, reportPath);
            } catch (RuntimeException e) {
                LOG.error("Notify channel {} failed: {}", channel.getClass().getSimpleName(), e.toString());
                first = first == null ? e : first;
            }
        }
        if (first != null) {
            throw first;
        }
    }

    @Override
    public void sendFailure(String errorMessage, JSONObject progressDocument) {
        RuntimeException first = null;
        for (PipelineNotifier channel : channels) {
            try {
                channel.sendFailure(errorMessage, progressDocument);
            } catch (RuntimeException e) {
                LOG.error("Notify channel {} failed: {}", channel.getClass().getSimpleName(), e.toString());
                first = first == null ? e : first;
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
