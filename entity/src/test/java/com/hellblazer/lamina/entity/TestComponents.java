package com.hellblazer.lamina.entity;

import java.util.List;

/**
 * Component types shared by the entity tests.
 */
final class TestComponents {

    private TestComponents() {
    }

    static final class Health extends Component {
        int value = 100;
    }

    static final class Inventory extends Component {
    }

    /**
     * Appends "Type:hook" to a shared journal for every lifecycle hook.
     */
    static class Recording extends Component {
        private final List<String> journal;

        Recording(List<String> journal) {
            this.journal = journal;
        }

        private void record(String hook) {
            journal.add(getClass().getSimpleName() + ":" + hook);
        }

        @Override
        protected void onAdd() {
            record("add");
        }

        @Override
        protected void onInitialize() {
            record("init");
        }

        @Override
        protected void onStartup() {
            record("start");
        }

        @Override
        protected void onShutdown() {
            record("shutdown");
        }

        @Override
        protected void onRemove() {
            record("remove");
        }
    }

    static final class Alpha extends Recording {
        Alpha(List<String> journal) {
            super(journal);
        }
    }

    static final class Beta extends Recording {
        Beta(List<String> journal) {
            super(journal);
        }
    }

    static final class ExplodingShutdown extends Component {
        @Override
        protected void onShutdown() {
            throw new IllegalStateException("shutdown failure");
        }
    }

    static final class ExplodingInitialize extends Component {
        @Override
        protected void onInitialize() {
            throw new IllegalStateException("initialize failure");
        }
    }
}
