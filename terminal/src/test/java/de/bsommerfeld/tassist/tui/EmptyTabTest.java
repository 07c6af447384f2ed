package de.bsommerfeld.tassist.tui;

import de.bsommerfeld.tassist.core.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmptyTabTest {

    private Context context;
    private Tui tui;
    private int tabId;

    @BeforeEach
    void setUp() {
        context = new Context();
        tui = new Tui();
        context.addResource(tui);
        tabId = tui.addTab(context, EmptyTab.INSTANCE);
    }

    private String render() {
        TabCanvas canvas = new TabCanvas(40);
        EmptyTab.INSTANCE.render(context, canvas, tabId);
        return canvas.plainText();
    }

    @Test
    void render_shouldReportMissingKinds() {
        assertEquals("No creatable tab types.", render());

        context.addResource(new NewTabKinds());
        assertEquals("No creatable tab types.", render());
    }

    @Test
    void render_shouldListRegisteredKinds() {
        NewTabKinds kinds = new NewTabKinds();
        kinds.register(new CounterTab("Alpha"));
        kinds.register(new CounterTab("Beta"));
        context.addResource(kinds);

        assertEquals("Open a tab:\n\n  Alpha\n  Beta", render());
    }

    @Test
    void select_shouldReplaceTabWithChosenKind() {
        CounterTab beta = new CounterTab("Beta");
        NewTabKinds kinds = new NewTabKinds();
        kinds.register(new CounterTab("Alpha"));
        kinds.register(beta);
        context.addResource(kinds);

        EmptyTab.INSTANCE.handleKey(context, EmptyTab.MOVE_DOWN, tabId);
        EmptyTab.INSTANCE.handleKey(context, EmptyTab.MOVE_DOWN, tabId);
        assertEquals(1, TabStates.get(context, EmptyTab.INSTANCE, tabId).cursor());

        EmptyTab.INSTANCE.handleKey(context, EmptyTab.SELECT, tabId);

        assertSame(beta, tui.tab(tabId).orElseThrow().kind());
        assertEquals(0, TabStates.get(context, beta, tabId).value());
    }

    @Test
    void moveUp_shouldStopAtFirstEntry() {
        NewTabKinds kinds = new NewTabKinds();
        kinds.register(new CounterTab("Alpha"));
        context.addResource(kinds);

        EmptyTab.INSTANCE.handleKey(context, EmptyTab.MOVE_UP, tabId);

        assertEquals(0, TabStates.get(context, EmptyTab.INSTANCE, tabId).cursor());
    }

    @Test
    void register_shouldRejectDuplicateNames() {
        NewTabKinds kinds = new NewTabKinds();
        kinds.register(new CounterTab("Alpha"));

        assertThrows(IllegalArgumentException.class, () -> kinds.register(new CounterTab("Alpha")));
    }
}
