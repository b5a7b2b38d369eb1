package com.storybuilder.core.grid;

import com.storybuilder.core.model.GridItem;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NaturalOrderComparatorTest {

    @Test
    void ordersEmbeddedNumbersNumerically() {
        List<String> names = new ArrayList<>(List.of("img2.png", "img10.png", "img1.png"));
        names.sort(NaturalOrderComparator.INSTANCE);
        assertEquals(List.of("img1.png", "img2.png", "img10.png"), names);
    }

    @Test
    void comparesTextIgnoringCase() {
        assertEquals(0, NaturalOrderComparator.INSTANCE.compare("Shot.PNG", "shot.png"));
        assertTrue(NaturalOrderComparator.INSTANCE.compare("Beta", "alpha") > 0);
        assertTrue(NaturalOrderComparator.INSTANCE.compare("img", "img1") < 0);
    }

    @Test
    void handlesNumbersBeyondLongRange() {
        assertTrue(NaturalOrderComparator.INSTANCE.compare("a99999999999999999999", "a100000000000000000000") < 0);
    }

    @Test
    void sortsItemsByBaseNameAndKeepsTiesInInputOrder() {
        List<GridItem> items = new ArrayList<>(List.of(
            new GridItem("/z/shot10.png", "SHOT 1"),
            new GridItem("/a/shot2.png", "SHOT 2"),
            new GridItem("/b/SHOT2.png", "SHOT 3"),
            new GridItem("", "SHOT 4")));

        NaturalOrderComparator.sortByBaseName(items);

        assertEquals(List.of("SHOT 4", "SHOT 2", "SHOT 3", "SHOT 1"),
            items.stream().map(GridItem::label).toList());
    }

    @Test
    void baseNameHandlesBothSeparators() {
        assertEquals("c.png", NaturalOrderComparator.baseName("a/b/c.png"));
        assertEquals("c.png", NaturalOrderComparator.baseName("C:\\b\\c.png"));
        assertEquals("c.png", NaturalOrderComparator.baseName("c.png"));
    }
}
