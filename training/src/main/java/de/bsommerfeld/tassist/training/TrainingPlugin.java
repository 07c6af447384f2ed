package de.bsommerfeld.tassist.training;

import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.Plugin;
import de.bsommerfeld.tassist.core.db.TableDescriptor;
import de.bsommerfeld.tassist.tui.NewTabKinds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the training tables: {@code trainer}, {@code client},
 * {@code exercise} and {@code session}. Offers the "Schedule" tab when the
 * {@code TuiPlugin} ran before this plugin.
 */
public final class TrainingPlugin implements Plugin {

    private static final Logger LOG = LoggerFactory.getLogger(TrainingPlugin.class);

    public static final String TRAINER_TABLE = "trainer";
    public static final String CLIENT_TABLE = "client";
    public static final String EXERCISE_TABLE = "exercise";
    public static final String SESSION_TABLE = "session";

    static final TableDescriptor<Trainer> TRAINERS = TableDescriptor.of(TRAINER_TABLE, Trainer.class);
    static final TableDescriptor<Client> CLIENTS = TableDescriptor.of(CLIENT_TABLE, Client.class);
    static final TableDescriptor<Exercise> EXERCISES = TableDescriptor.of(EXERCISE_TABLE, Exercise.class);
    static final TableDescriptor<Session> SESSIONS = TableDescriptor.of(SESSION_TABLE, Session.class);

    @Override
    public void build(Context context) {
        context.addTable(TRAINERS)
                .addTable(CLIENTS)
                .addTable(EXERCISES)
                .addTable(SESSIONS);

        if (!NewTabKinds.registerIfPresent(context, ScheduleTab.INSTANCE)) {
            LOG.debug("No terminal UI registered, schedule tab not offered");
        }
    }
}
