package org.pbxlink.alert.support;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;

/**
 * Transaction manager without a resource behind it. Tracks begin, commit and rollback per thread
 * and honours participation, suspension and global rollback-only the way the JPA manager does.
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

    private final ThreadLocal<State> current = new ThreadLocal<>();

    private int begun;
    private int committed;
    private int rolledBack;

    public int getBegun() {
        return begun;
    }

    public int getCommitted() {
        return committed;
    }

    public int getRolledBack() {
        return rolledBack;
    }

    @Override
    protected Object doGetTransaction() {
        return new TxObject(current.get());
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((TxObject) transaction).state != null;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        State state = new State();
        ((TxObject) transaction).state = state;
        current.set(state);
        begun++;
    }

    @Override
    protected Object doSuspend(Object transaction) {
        ((TxObject) transaction).state = null;
        State suspended = current.get();
        current.remove();
        return suspended;
    }

    @Override
    protected void doResume(Object transaction, Object suspendedResources) {
        current.set((State) suspendedResources);
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        committed++;
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        rolledBack++;
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        ((TxObject) status.getTransaction()).state.rollbackOnly = true;
    }

    @Override
    protected void doCleanupAfterCompletion(Object transaction) {
        current.remove();
    }

    private static final class State {
        private boolean rollbackOnly;
    }

    private static final class TxObject implements SmartTransactionObject {

        private State state;

        private TxObject(State state) {
            this.state = state;
        }

        @Override
        public boolean isRollbackOnly() {
            return state != null && state.rollbackOnly;
        }

        @Override
        public void flush() {
        }
    }
}
