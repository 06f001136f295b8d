package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Combo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ComboQueriesTest {

    private final List<Combo> combos = new ComboEngine()
            .analyze(ComboAuditInput.of("Learn Spanish", "French Lessons"), EngineConfig.defaults())
            .getCombos();

    @Test
    public void filtersBySubstringIgnoringCase() {
        List<Combo> out = ComboQueries.filterByKeyword(combos, "SPAN");
        assertEquals(7, out.size());
        assertTrue(out.stream().allMatch(c -> c.getText().contains("spanish")));
        assertEquals(combos.size(), ComboQueries.filterByKeyword(combos, null).size());
    }

    @Test
    public void groupsByLength() {
        Map<Integer, List<Combo>> groups = ComboQueries.groupByLength(combos);
        assertEquals(List.of(2, 3, 4), List.copyOf(groups.keySet()));
        assertEquals(6, groups.get(2).size());
        assertEquals(4, groups.get(3).size());
        assertEquals(1, groups.get(4).size());
    }

    @Test
    public void countsWholeWordMatches() {
        assertEquals(7, ComboQueries.countWithKeyword(combos, "French"));
        assertEquals(0, ComboQueries.countWithKeyword(combos, "fren"));
        assertEquals(0, ComboQueries.countWithKeyword(combos, null));
    }

    @Test
    public void topByPriorityIsSortedAndBounded() {
        List<Combo> top = ComboQueries.topByPriority(combos, 3);
        assertEquals(3, top.size());
        assertTrue(top.get(0).getPriorityScore() >= top.get(1).getPriorityScore());
        assertTrue(top.get(1).getPriorityScore() >= top.get(2).getPriorityScore());
        assertEquals(combos.size(), ComboQueries.topByPriority(combos, 100).size());
        assertTrue(ComboQueries.topByPriority(combos, -1).isEmpty());
    }
}
