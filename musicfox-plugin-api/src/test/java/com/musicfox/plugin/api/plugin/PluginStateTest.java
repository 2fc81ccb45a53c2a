package com.musicfox.plugin.api.plugin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.musicfox.plugin.api.plugin.PluginState.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginState 单元测试")
public class PluginStateTest {

    // 期望的迁移表，与状态图逐项对照
    private static final Map<PluginState, Set<PluginState>> EXPECTED = new EnumMap<>(PluginState.class);

    static {
        EXPECTED.put(UNKNOWN, EnumSet.of(LOADED, ERROR));
        EXPECTED.put(LOADED, EnumSet.of(RUNNING, UNLOADING, ERROR));
        EXPECTED.put(RUNNING, EnumSet.of(STOPPING, PAUSED, ERROR));
        EXPECTED.put(STOPPING, EnumSet.of(STOPPED, ERROR));
        EXPECTED.put(STOPPED, EnumSet.of(RUNNING, UNLOADING, ERROR));
        EXPECTED.put(UNLOADING, EnumSet.of(UNLOADED, CLEANING, ERROR, CORRUPTED));
        EXPECTED.put(UNLOADED, EnumSet.of(LOADED, ERROR));
        EXPECTED.put(ERROR, EnumSet.of(CLEANING, CORRUPTED, UNLOADING));
        EXPECTED.put(PAUSED, EnumSet.of(RUNNING, STOPPING, ERROR));
        EXPECTED.put(CLEANING, EnumSet.of(UNLOADED, ERROR, CORRUPTED));
        EXPECTED.put(CORRUPTED, EnumSet.of(CLEANING, UNLOADING));
    }

    @Nested
    @DisplayName("迁移表")
    class TransitionTableTests {

        @Test
        @DisplayName("11x11 全部组合与状态图一致")
        void allPairsShouldMatchTable() {
            int checked = 0;
            for (PluginState from : PluginState.values()) {
                for (PluginState to : PluginState.values()) {
                    boolean expected = EXPECTED.get(from).contains(to);
                    assertEquals(expected, PluginState.isValidTransition(from, to), from + " -> " + to);
                    assertEquals(expected, from.canTransitionTo(to), from + " -> " + to);
                    checked++;
                }
            }
            assertEquals(121, checked);
        }

        @ParameterizedTest
        @EnumSource(PluginState.class)
        @DisplayName("任何状态都不能迁移到自身")
        void selfTransitionShouldBeInvalid(PluginState state) {
            assertFalse(PluginState.isValidTransition(state, state));
        }

        @Test
        @DisplayName("null 参与的迁移一律非法")
        void nullShouldBeInvalid() {
            assertFalse(PluginState.isValidTransition(null, LOADED));
            assertFalse(PluginState.isValidTransition(LOADED, null));
        }

        @Test
        @DisplayName("allowedTargets 返回只读集合")
        void allowedTargetsShouldBeUnmodifiable() {
            Set<PluginState> targets = RUNNING.allowedTargets();
            assertEquals(EXPECTED.get(RUNNING), targets);
            assertThrows(UnsupportedOperationException.class, () -> targets.add(UNLOADED));
        }
    }

    @Nested
    @DisplayName("状态谓词")
    class PredicateTests {

        @ParameterizedTest
        @EnumSource(PluginState.class)
        @DisplayName("canUnload 仅对 loaded/stopped/error/paused 成立")
        void canUnload(PluginState state) {
            boolean expected = state == LOADED || state == STOPPED || state == ERROR || state == PAUSED;
            assertEquals(expected, state.canUnload());
        }

        @ParameterizedTest
        @EnumSource(PluginState.class)
        @DisplayName("canStop 仅对 running/paused 成立")
        void canStop(PluginState state) {
            assertEquals(state == RUNNING || state == PAUSED, state.canStop());
        }

        @ParameterizedTest
        @EnumSource(PluginState.class)
        @DisplayName("isTransitional 仅对 stopping/unloading/cleaning 成立")
        void isTransitional(PluginState state) {
            assertEquals(state == STOPPING || state == UNLOADING || state == CLEANING, state.isTransitional());
        }
    }

    @Test
    @DisplayName("字符串形式为小写名称")
    void toStringShouldBeLowercaseValue() {
        assertEquals("running", RUNNING.toString());
        assertEquals("unloaded", UNLOADED.getValue());
    }
}
