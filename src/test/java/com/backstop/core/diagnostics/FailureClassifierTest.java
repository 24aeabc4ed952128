package com.backstop.core.diagnostics;

import com.backstop.core.model.CrashClassification;
import com.backstop.core.recovery.FailureKind;
import com.backstop.core.recovery.RetryStrategy;
import com.backstop.core.resource.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier(new DiagnosticsProperties());

    @Nested
    @DisplayName("classifyCrash")
    class ClassifyCrash {

        @Test
        @DisplayName("Resource errors are RESOURCE_NOT_FOUND")
        void resource() {
            assertEquals(CrashClassification.RESOURCE_NOT_FOUND,
                    classifier.classifyCrash(new ResourceNotFoundException("setting", "missing layout"), "ctx"));
            assertEquals(CrashClassification.RESOURCE_NOT_FOUND,
                    classifier.classifyCrash(new FileNotFoundException("theme.xml"), "ctx"));
        }

        @Test
        @DisplayName("Lifecycle wording wins over component wording")
        void lifecycle() {
            assertEquals(CrashClassification.LIFECYCLE_ERROR,
                    classifier.classifyCrash(new IllegalStateException("Fragment view destroyed"), "ctx"));
        }

        @Test
        @DisplayName("Component wording is CUSTOM_COMPONENT_FAILURE")
        void component() {
            assertEquals(CrashClassification.CUSTOM_COMPONENT_FAILURE,
                    classifier.classifyCrash(new RuntimeException("Failed to render toggle"), "ctx"));
        }

        @Test
        @DisplayName("OutOfMemoryError is MEMORY_ERROR")
        void memory() {
            assertEquals(CrashClassification.MEMORY_ERROR,
                    classifier.classifyCrash(new OutOfMemoryError("bitmap"), "ctx"));
        }

        @Test
        @DisplayName("Feature area in the context is DOMAIN_SPECIFIC_ERROR")
        void featureArea() {
            assertEquals(CrashClassification.DOMAIN_SPECIFIC_ERROR,
                    classifier.classifyCrash(new RuntimeException("boom"), "glass.onFailure"));
        }

        @Test
        @DisplayName("Anything else is UNKNOWN, null message included")
        void unknown() {
            assertEquals(CrashClassification.UNKNOWN,
                    classifier.classifyCrash(new RuntimeException((String) null), "component.onFailure"));
        }
    }

    @Nested
    @DisplayName("classifyKind")
    class ClassifyKind {

        @Test
        @DisplayName("State loss retries allowing state loss")
        void stateLoss() {
            var kind = classifier.classifyKind(new RuntimeException("Commit after state saved"));
            assertEquals(FailureKind.STATE_LOSS, kind);
            assertEquals(RetryStrategy.RETRY_ALLOWING_STATE_LOSS, kind.strategy());
        }

        @Test
        @DisplayName("Not attached retries after a delay")
        void notAttached() {
            var kind = classifier.classifyKind(new IllegalStateException("Fragment not attached to a context"));
            assertEquals(FailureKind.NOT_ATTACHED, kind);
            assertEquals(RetryStrategy.RETRY_AFTER_DELAY, kind.strategy());
        }

        @Test
        @DisplayName("Destroyed forces cleanup")
        void destroyed() {
            var kind = classifier.classifyKind(new IllegalStateException("Activity has been destroyed"));
            assertEquals(FailureKind.LIFECYCLE_ERROR, kind);
            assertEquals(RetryStrategy.FORCE_CLEANUP, kind.strategy());
        }

        @Test
        @DisplayName("Other IllegalStateException is ILLEGAL_STATE")
        void illegalState() {
            assertEquals(FailureKind.ILLEGAL_STATE, classifier.classifyKind(new IllegalStateException("bad")));
        }

        @Test
        @DisplayName("Everything else aborts")
        void unknown() {
            var kind = classifier.classifyKind(new RuntimeException("?"));
            assertEquals(FailureKind.UNKNOWN, kind);
            assertEquals(RetryStrategy.ABORT, kind.strategy());
        }
    }
}
