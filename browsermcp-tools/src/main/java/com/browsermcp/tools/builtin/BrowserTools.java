package com.browsermcp.tools.builtin;

import com.browsermcp.tools.BrowserTool;

import java.util.List;

/**
 * The full tool set, in listing order.
 */
public final class BrowserTools {

    private BrowserTools() {
    }

    public static List<BrowserTool> all() {
        return List.of(
                CommonTools.navigate(),
                CommonTools.goBack(),
                CommonTools.goForward(),

                SnapshotTools.snapshot(),
                SnapshotTools.click(),
                SnapshotTools.drag(),
                SnapshotTools.hover(),
                SnapshotTools.type(),
                SnapshotTools.selectOption(),

                CommonTools.pressKey(),
                CommonTools.waitFor(),

                CustomTools.getConsoleLogs(),
                CustomTools.screenshot());
    }
}
