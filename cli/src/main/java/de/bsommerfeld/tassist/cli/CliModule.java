package de.bsommerfeld.tassist.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.config.AppConfig;
import de.bsommerfeld.tassist.core.config.ApplicationMode;
import de.bsommerfeld.tassist.core.config.ConfigLoader;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.db.DbCommandsPlugin;
import de.bsommerfeld.tassist.training.TrainingPlugin;
import de.bsommerfeld.tassist.tui.TuiPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring the command line front-end: the configuration and a
 * started {@link Context} with every plugin of the application.
 *
 * <p>
 * Plugin order matters. {@link TuiPlugin} comes first so that the plugins
 * after it can offer their tab kinds.
 */
public class CliModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CliModule.class);

    private final ApplicationMode mode;
    private final Path configFile;

    public CliModule(ApplicationMode mode, Path configFile) {
        this.mode = mode;
        this.configFile = configFile;
    }

    @Override
    protected void configure() {
        LOG.info("Application Mode initialized: {}", mode);
        bind(ApplicationMode.class).toInstance(mode);
    }

    @Provides
    @Singleton
    AppConfig appConfig() throws FrameworkException {
        if (mode.isTest()) {
            LOG.info("TEST MODE: using default configuration, {} is not read", configFile.toAbsolutePath());
            return new AppConfig();
        }
        LOG.info("Loading Configuration from: {}", configFile.toAbsolutePath());
        return new ConfigLoader().load(configFile);
    }

    @Provides
    @Singleton
    Context context(AppConfig config) throws FrameworkException {
        Context context = new Context();
        if (mode.isTest()) {
            // TEST MODE: no database file
            context.inMemoryDb(true);
        } else {
            context.inMemoryDb(config.getDatabase().isInMemory());
            config.getDatabase().resolvedPath().ifPresent(context::dbPath);
        }
        context.addPlugin(new TuiPlugin())
                .addPlugin(new TrainingPlugin())
                .addPlugin(new DbCommandsPlugin());
        context.startup();
        return context;
    }
}
