package de.bsommerfeld.tassist.training;

import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.tui.StatelessTab;
import de.bsommerfeld.tassist.tui.TabCanvas;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sessions ordered by date, oldest first, with trainer and client names
 * resolved. Sessions that cannot be loaded yet (a freshly added row without a
 * date, say) are listed after the dated ones. Sessions from today on are
 * shown in bold.
 */
final class ScheduleTab extends StatelessTab {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleTab.class);

    static final ScheduleTab INSTANCE = new ScheduleTab();

    private ScheduleTab() {
    }

    @Override
    public String name() {
        return "Schedule";
    }

    @Override
    public void render(Context context, TabCanvas canvas, int tabId) throws FrameworkException {
        DbConnection db = context.dbConnection();
        List<Entry> dated = new ArrayList<>();
        List<RowId> incomplete = new ArrayList<>();
        for (RowId id : db.rowIds(TrainingPlugin.SESSION_TABLE)) {
            try {
                Session session = TrainingPlugin.SESSIONS.load(db, id);
                dated.add(new Entry(id, session.date(), TrainingPlugin.SESSIONS.displayRow(db, id)));
            } catch (FrameworkException e) {
                LOG.debug("Session {} not scheduled: {}", id, e.getMessage());
                incomplete.add(id);
            }
        }

        if (dated.isEmpty() && incomplete.isEmpty()) {
            canvas.line("No sessions scheduled.");
            return;
        }

        dated.sort(Comparator.comparing(Entry::date).thenComparing(Entry::id));
        LocalDate today = LocalDate.now();
        canvas.line("Schedule").blank();
        for (Entry entry : dated) {
            // cells: id, date, trainer, client, charge
            String line = entry.date() + "  " + entry.cells().get(2) + " with " + entry.cells().get(3);
            if (entry.date().isBefore(today)) {
                canvas.line(line);
            } else {
                canvas.styled(line, AttributedStyle.BOLD);
            }
        }
        if (!incomplete.isEmpty()) {
            canvas.blank().line("Incomplete sessions: " + incomplete);
        }
    }

    private record Entry(RowId id, LocalDate date, List<String> cells) {
    }
}
