package com.backstop.core.resource;

import com.backstop.core.model.RecommendedAction;
import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ResourceKind;
import com.backstop.testsupport.FakeResourceEnvironment;
import com.backstop.testsupport.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ResourceCatalogValidatorTest {

    private final FakeResourceEnvironment environment = new FakeResourceEnvironment();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final ResourceCatalogValidator validator = new ResourceCatalogValidator(environment, clock);

    @Nested
    @DisplayName("validate(catalog)")
    class ValidateCatalog {

        @Test
        @DisplayName("Everything resolves -> PROCEED_NORMAL")
        void allPresent() {
            var report = validator.validate(UiResource.CATALOG);

            assertTrue(report.allAvailable());
            assertEquals(RecommendedAction.PROCEED_NORMAL, report.recommendedAction());
        }

        @Test
        @DisplayName("Missing colors with fallbacks -> USE_FALLBACK_UI")
        void missingColors() {
            environment.remove("focus", "white");

            var report = validator.validate(UiResource.CATALOG);

            assertEquals(List.of("focus", "white"), report.missing(ResourceKind.COLOR));
            assertEquals(2, report.fallbacksAvailable());
            assertEquals(RecommendedAction.USE_FALLBACK_UI, report.recommendedAction());
        }

        @Test
        @DisplayName("Missing layout -> USE_EMERGENCY_UI")
        void missingLayout() {
            environment.remove("setting");

            var report = validator.validate(UiResource.CATALOG);

            assertEquals(List.of("setting"), report.missing(ResourceKind.LAYOUT));
            assertEquals(RecommendedAction.USE_EMERGENCY_UI, report.recommendedAction());
        }

        @Test
        @DisplayName("Resolving but failing to load counts as missing")
        void loadFailureIsMissing() {
            environment.failLoading("modern_toggle_thumb");

            var report = validator.validate(UiResource.CATALOG);

            assertEquals(List.of("modern_toggle_thumb"), report.missing(ResourceKind.VISUAL));
        }

        @Test
        @DisplayName("Two passes over an unchanged environment agree")
        void idempotent() {
            environment.remove("focus", "setting");

            var first = validator.validate(UiResource.CATALOG);
            var second = validator.validate(UiResource.CATALOG);

            assertEquals(first.missingByKind(), second.missingByKind());
            assertEquals(first.recommendedAction(), second.recommendedAction());
        }
    }

    @Test
    @DisplayName("Ad-hoc descriptors have no fallbacks")
    void adHocDescriptors() {
        environment.remove("custom_glow");

        var report = validator.validate(List.of(
                new ResourceDescriptor("custom_glow", ResourceKind.VISUAL),
                new ResourceDescriptor("focus", ResourceKind.COLOR)));

        assertEquals(0, report.fallbacksAvailable());
        assertEquals(RecommendedAction.ABORT, report.recommendedAction());
    }

    @Test
    @DisplayName("fallbackMap lists only missing resources that have a fallback")
    void fallbackMap() {
        environment.remove("focus", "setting", "toggle_padding");

        var mapping = validator.fallbackMap(UiResource.CATALOG);

        assertEquals(2, mapping.size());
        assertEquals("#FF00DDFF", mapping.get("focus"));
        assertEquals("8dp", mapping.get("toggle_padding"));
        assertFalse(mapping.containsKey("setting"));
    }

    @Test
    @DisplayName("Environment that throws on load is handled")
    void throwingEnvironment() throws Exception {
        ResourceEnvironment broken = mock(ResourceEnvironment.class);
        when(broken.resolve(any())).thenReturn(Optional.of("handle"));
        when(broken.load(any(), anyString())).thenThrow(new IllegalStateException("decode failed"));

        var report = new ResourceCatalogValidator(broken, clock).validate(UiResource.CATALOG);

        assertEquals(UiResource.CATALOG.size(), report.missingCount());
        verify(broken, times(UiResource.CATALOG.size())).load(any(), anyString());
    }

    @Test
    @DisplayName("Report is stamped with the injected clock")
    void timestampFromClock() {
        clock.advance(Duration.ofMinutes(5));

        var report = validator.validate(UiResource.CATALOG);

        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), report.timestamp());
    }
}
