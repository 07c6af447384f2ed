package de.bsommerfeld.tassist.db;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.Context;
import de.bsommerfeld.tassist.core.db.DbConnection;
import de.bsommerfeld.tassist.core.db.FieldInfo;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.db.TableDescriptor;
import de.bsommerfeld.tassist.core.error.FrameworkException;
import de.bsommerfeld.tassist.core.error.InvalidArgumentsException;
import de.bsommerfeld.tassist.tui.KeyBind;
import de.bsommerfeld.tassist.tui.KeyStroke;
import de.bsommerfeld.tassist.tui.KeyStroke.Key;
import de.bsommerfeld.tassist.tui.TabCanvas;
import de.bsommerfeld.tassist.tui.TabKind;
import de.bsommerfeld.tassist.tui.TabStates;
import de.bsommerfeld.tassist.tui.Tui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Spreadsheet-like editor for one table.
 *
 * <h3>Modes</h3>
 * <ol>
 * <li><strong>Choosing</strong>: lists the registered tables; Enter opens the
 * highlighted one.</li>
 * <li><strong>Browsing</strong>: shows the rows as a grid with a row and a
 * field cursor. Ctrl+N appends a row, Ctrl+D deletes the row under the
 * cursor, Esc goes back to choosing.</li>
 * <li><strong>Editing</strong>: Enter on a cell switches the terminal to text
 * input. Typed text replaces the cell on Enter and is discarded on Esc.</li>
 * </ol>
 *
 * Failures such as unparsable input are kept in the tab state and shown under
 * the grid until the next key.
 */
final class EditTableTab implements TabKind<EditTableTab.State> {

    private static final Logger LOG = LoggerFactory.getLogger(EditTableTab.class);

    static final EditTableTab INSTANCE = new EditTableTab();

    static final String MOVE_UP = "move_up";
    static final String MOVE_DOWN = "move_down";
    static final String MOVE_LEFT = "move_left";
    static final String MOVE_RIGHT = "move_right";
    static final String SELECT = "select";
    static final String BACK = "back";
    static final String NEW_ROW = "new_row";
    static final String DELETE_ROW = "delete_row";

    private static final List<KeyBind> CHOOSER_BINDS = List.of(
            KeyBind.of(MOVE_UP, "Move Up", KeyStroke.of(Key.UP)),
            KeyBind.of(MOVE_DOWN, "Move Down", KeyStroke.of(Key.DOWN)),
            KeyBind.of(SELECT, "Select", KeyStroke.of(Key.ENTER)));

    private static final List<KeyBind> GRID_BINDS = List.of(
            KeyBind.of(MOVE_UP, "Move Up", KeyStroke.of(Key.UP)),
            KeyBind.of(MOVE_DOWN, "Move Down", KeyStroke.of(Key.DOWN)),
            KeyBind.of(MOVE_RIGHT, "Move Right", KeyStroke.of(Key.RIGHT)),
            KeyBind.of(MOVE_LEFT, "Move Left", KeyStroke.of(Key.LEFT)),
            KeyBind.of(SELECT, "Edit", KeyStroke.of(Key.ENTER)),
            KeyBind.of(BACK, "Back", KeyStroke.of(Key.ESCAPE)),
            KeyBind.of(NEW_ROW, "New Row", KeyStroke.ctrl('n')),
            KeyBind.of(DELETE_ROW, "Delete Row", KeyStroke.ctrl('d')));

    /**
     * @param cursor highlighted entry while choosing a table
     * @param table  the open table, {@code null} while choosing
     * @param row    index into the table's rows in id order
     * @param column index into the table's fields
     * @param input  text typed so far, {@code null} unless editing
     * @param error  last failure, {@code null} if none
     */
    record State(int cursor, String table, int row, int column, String input, String error) {

        static State choosing(int cursor) {
            return new State(cursor, null, 0, 0, null, null);
        }

        boolean isChoosing() {
            return table == null;
        }

        boolean isEditing() {
            return input != null;
        }

        State withCell(int row, int column) {
            return new State(cursor, table, row, column, null, null);
        }

        State withInput(String input) {
            return new State(cursor, table, row, column, input, null);
        }

        State withError(String error) {
            return new State(cursor, table, row, column, null, error);
        }
    }

    private EditTableTab() {
    }

    @Override
    public String name() {
        return "Edit Table";
    }

    @Override
    public String title(Context context, int tabId) {
        State state = TabStates.get(context, this, tabId);
        return state.isChoosing() ? name() : "Edit " + state.table();
    }

    // =====================================================================
    // Rendering
    // =====================================================================

    @Override
    public void render(Context context, TabCanvas canvas, int tabId) throws FrameworkException {
        State state = TabStates.get(context, this, tabId);
        DbConnection db = context.dbConnection();
        if (state.isChoosing()) {
            renderChooser(db, canvas, state);
        } else {
            renderGrid(db, canvas, state);
        }
        if (state.error() != null) {
            canvas.blank().line("error: " + state.error());
        }
    }

    private static void renderChooser(DbConnection db, TabCanvas canvas, State state) {
        List<String> names = tableNames(db);
        if (names.isEmpty()) {
            canvas.line("No tables.");
            return;
        }
        canvas.line("Select a table:").blank();
        for (int i = 0; i < names.size(); i++) {
            if (i == state.cursor()) {
                canvas.highlighted(">" + names.get(i));
            } else {
                canvas.line(" " + names.get(i));
            }
        }
    }

    private static void renderGrid(DbConnection db, TabCanvas canvas, State state) throws FrameworkException {
        TableDescriptor<?> table = DbCommandsPlugin.table(db, state.table());
        List<RowId> ids = db.rowIds(table.tableName());
        if (ids.isEmpty()) {
            canvas.line("No entries in table " + table.tableName() + ".");
            return;
        }

        TextTable grid = new TextTable(table.header());
        for (RowId id : ids) {
            grid.row(table.displayRow(db, id));
        }
        List<String> lines = grid.lines();
        int row = Math.min(state.row(), ids.size() - 1);
        // rule, header, rule, then each row followed by a rule
        int cursorLine = 3 + 2 * row;
        for (int i = 0; i < lines.size(); i++) {
            if (i == cursorLine) {
                canvas.highlighted(lines.get(i));
            } else {
                canvas.line(lines.get(i));
            }
        }

        if (table.fields().isEmpty()) {
            return;
        }
        FieldInfo field = table.fields().get(state.column());
        canvas.blank();
        if (state.isEditing()) {
            canvas.highlighted(field.column() + ": " + state.input() + "_");
        } else {
            canvas.line("Field: " + field.column() + " of row " + ids.get(row));
        }
    }

    // =====================================================================
    // Keys
    // =====================================================================

    @Override
    public List<KeyBind> keybinds(Context context, int tabId) {
        return TabStates.get(context, this, tabId).isChoosing() ? CHOOSER_BINDS : GRID_BINDS;
    }

    @Override
    public void handleKey(Context context, String bindName, int tabId) throws FrameworkException {
        State state = TabStates.get(context, this, tabId);
        DbConnection db = context.dbConnection();
        State next = state.isChoosing()
                ? chooserKey(db, bindName, state)
                : gridKey(context, db, bindName, state);
        TabStates.set(context, this, tabId, next);
    }

    private static State chooserKey(DbConnection db, String bindName, State state) {
        int tables = tableNames(db).size();
        switch (bindName) {
            case MOVE_UP:
                return State.choosing(Math.max(0, state.cursor() - 1));
            case MOVE_DOWN:
                return State.choosing(Math.max(0, Math.min(tables - 1, state.cursor() + 1)));
            case SELECT:
                if (tables == 0) {
                    return State.choosing(0);
                }
                String table = tableNames(db).get(Math.min(state.cursor(), tables - 1));
                LOG.debug("Editing table '{}'", table);
                return new State(state.cursor(), table, 0, 0, null, null);
            default:
                return state.withError(null);
        }
    }

    private static State gridKey(Context context, DbConnection db, String bindName, State state)
            throws FrameworkException {
        TableDescriptor<?> table = DbCommandsPlugin.table(db, state.table());
        List<RowId> ids = db.rowIds(table.tableName());
        int lastRow = Math.max(0, ids.size() - 1);
        int lastColumn = Math.max(0, table.fields().size() - 1);
        switch (bindName) {
            case MOVE_UP:
                return state.withCell(Math.max(0, state.row() - 1), state.column());
            case MOVE_DOWN:
                return state.withCell(Math.min(lastRow, state.row() + 1), state.column());
            case MOVE_LEFT:
                return state.withCell(state.row(), Math.max(0, state.column() - 1));
            case MOVE_RIGHT:
                return state.withCell(state.row(), Math.min(lastColumn, state.column() + 1));
            case SELECT:
                return startEditing(context, table, ids, state);
            case BACK:
                return State.choosing(state.cursor());
            case NEW_ROW:
                RowId created = db.newRow(table.tableName());
                LOG.debug("Added row {} to '{}' from the editor", created, table.tableName());
                return state.withCell(ids.size(), state.column());
            case DELETE_ROW:
                if (ids.isEmpty()) {
                    return state.withError(null);
                }
                db.removeRow(table.tableName(), ids.get(Math.min(state.row(), lastRow)));
                return state.withCell(Math.max(0, Math.min(state.row(), ids.size() - 2)), state.column());
            default:
                return state.withError(null);
        }
    }

    private static State startEditing(Context context, TableDescriptor<?> table, List<RowId> ids, State state)
            throws FrameworkException {
        if (ids.isEmpty() || table.fields().isEmpty()) {
            return state.withError(null);
        }
        FieldInfo field = table.fields().get(state.column());
        if (!FieldParser.isEditable(field)) {
            return state.withError("can't edit field type of " + field.column());
        }
        context.requireResource(Tui.class).setInputMode(Tui.InputMode.TEXT);
        return state.withInput("");
    }

    // =====================================================================
    // Text input
    // =====================================================================

    @Override
    public void handleText(Context context, KeyStroke key, int tabId) throws FrameworkException {
        State state = TabStates.get(context, this, tabId);
        if (!state.isEditing()) {
            context.requireResource(Tui.class).setInputMode(Tui.InputMode.BIND);
            return;
        }
        switch (key.key()) {
            case ESCAPE:
                finishEditing(context, tabId, state.withCell(state.row(), state.column()));
                break;
            case ENTER:
                finishEditing(context, tabId, commit(context.dbConnection(), state));
                break;
            case BACKSPACE:
                String input = state.input();
                if (!input.isEmpty()) {
                    TabStates.set(context, this, tabId, state.withInput(input.substring(0, input.length() - 1)));
                }
                break;
            case CHAR:
                if (!key.ctrl()) {
                    TabStates.set(context, this, tabId, state.withInput(state.input() + key.character()));
                }
                break;
            default:
                break;
        }
    }

    private void finishEditing(Context context, int tabId, State next) throws FrameworkException {
        TabStates.set(context, this, tabId, next);
        context.requireResource(Tui.class).setInputMode(Tui.InputMode.BIND);
    }

    private static State commit(DbConnection db, State state) throws FrameworkException {
        TableDescriptor<?> table = DbCommandsPlugin.table(db, state.table());
        List<RowId> ids = db.rowIds(table.tableName());
        if (state.row() >= ids.size()) {
            return state.withError("row no longer exists");
        }
        FieldInfo field = table.fields().get(state.column());
        RowId row = ids.get(state.row());
        try {
            db.setField(table.tableName(), row, field.column(), FieldParser.parse(field, state.input()));
        } catch (InvalidArgumentsException e) {
            return state.withError(e.getMessage());
        }
        LOG.debug("Set {}.{} of row {} from the editor", table.tableName(), field.column(), row);
        return state.withCell(state.row(), state.column());
    }

    // =====================================================================
    // State
    // =====================================================================

    @Override
    public TypeToken<State> stateType() {
        return TypeToken.of(State.class);
    }

    @Override
    public State initialState() {
        return State.choosing(0);
    }

    private static List<String> tableNames(DbConnection db) {
        return db.tables().stream().map(TableDescriptor::tableName).collect(Collectors.toList());
    }
}
