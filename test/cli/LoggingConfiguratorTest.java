package cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreLevels() {
        context.getLogger("application").setLevel(Level.INFO);
        context.getLogger("domain").setLevel(null);
    }

    @Test
    void shouldEnableDebugForSearchLoggers() {
        LoggingConfigurator.configure(true);

        for (String name : LoggingConfigurator.SEARCH_LOGGERS) {
            assertThat(context.getLogger(name).getLevel()).isEqualTo(Level.DEBUG);
        }
        assertThat(LoggerFactory.getLogger("domain.engine.MeetInTheMiddleEngine").isDebugEnabled()).isTrue();
    }

    @Test
    void shouldLeaveLevelsAloneWithoutDebug() {
        LoggingConfigurator.configure(false);

        assertThat(context.getLogger("application").getLevel()).isEqualTo(Level.INFO);
    }
}
