package eventmanager.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event manager.
 *
 * @see EventManagerAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventmanager")
public class EventManagerProperties {

    /**
     * Guard registration and dispatch with a single lock. Enable when listeners
     * are registered or events dispatched from several threads.
     */
    private boolean threadSafe = false;

    private final Metrics metrics = new Metrics();

    public boolean isThreadSafe() {
        return threadSafe;
    }

    public void setThreadSafe(boolean threadSafe) {
        this.threadSafe = threadSafe;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventmanager";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
