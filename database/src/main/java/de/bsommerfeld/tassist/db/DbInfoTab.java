package de.bsommerfeld.tassist.db;

import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.TableDescriptor;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.tui.StatelessTab;
import de.bsommerfeld.tassist.tui.TabCanvas;

/** Read-only tab with the same text as {@code db info}, plus the row count per table. */
final class DbInfoTab extends StatelessTab {

    static final DbInfoTab INSTANCE = new DbInfoTab();

    private DbInfoTab() {
    }

    @Override
    public String name() {
        return "Database Info";
    }

    @Override
    public void render(Context context, TabCanvas canvas, int tabId) throws FrameworkException {
        DbConnection db = context.dbConnection();
        canvas.line(DbCommandsPlugin.infoText(db));
        if (!db.isOpen()) {
            return;
        }
        canvas.blank();
        for (TableDescriptor<?> table : db.tables()) {
            canvas.line(table.tableName() + ": " + db.rowIds(table.tableName()).size() + " row(s)");
        }
    }
}
