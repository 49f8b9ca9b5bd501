package net.spotter.integration.spring.tx;

import net.spotter.adapter.jdbc.TxContext;
import net.spotter.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 TxContext 를 채워 주는 TxRunner.
 * 본문이 던진 검사 예외는 롤백 후 원래 타입 그대로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        try {
            return tpl.execute(status -> inContext(body));
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private <T> T inContext(Callable<T> body) {
        // 스프링 트랜잭션의 물리 커넥션을 TxContext 에 꽂는다. 중첩이면 바깥 것을 잠시 치워 둔다
        Connection outer = TxContext.get();
        Connection con = DataSourceUtils.getConnection(ds);
        try {
            TxContext.set(con);
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        } finally {
            TxContext.clear();
            DataSourceUtils.releaseConnection(con, ds);
            if (outer != null) TxContext.set(outer);
        }
    }

    /** TransactionTemplate 을 통과시키기 위한 포장. 바깥으로는 나가지 않는다 */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) {
            super(cause);
        }

        @Override
        public synchronized Exception getCause() {
            return (Exception) super.getCause();
        }
    }
}
