package io.surveylogic.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.surveylogic.cli.config.CliConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging.*} settings of a {@link CliConfig} on top of {@code logback.xml}.
 *
 * <p>
 * The level is set on the {@code io.surveylogic} loggers only; third-party libraries keep the root
 * level from {@code logback.xml}. The format picks the encoder of the {@code STDERR} appender
 * declared there. Without that appender only the level is applied.
 */
final class LogbackConfigurator {

    static final String ENGINE_LOGGER = "io.surveylogic";
    static final String APPENDER = "STDERR";
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LogbackConfigurator.class);

    private LogbackConfigurator() {}

    static void apply(CliConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(ENGINE_LOGGER).setLevel(Level.toLevel(config.loggingLevel(), Level.WARN));

        Appender<ILoggingEvent> appender = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(APPENDER);
        if (!(appender instanceof OutputStreamAppender<ILoggingEvent> stream)) {
            LOG.warn("No {} appender configured; logging.format={} ignored", APPENDER, config.loggingFormat());
            return;
        }
        stream.stop();
        stream.setEncoder(encoderFor(config.loggingFormat(), context));
        stream.start();
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
