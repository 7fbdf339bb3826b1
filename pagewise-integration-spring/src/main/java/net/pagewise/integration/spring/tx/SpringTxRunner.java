package net.pagewise.integration.spring.tx;

import net.pagewise.adapter.jdbc.TxContext;
import net.pagewise.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 TxContext 를 채워 준다.
 * 본문이 던진 checked 예외는 롤백 후 원래 타입 그대로 다시 던진다.
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
            return tpl.execute(status -> {
                Connection outer = TxContext.get();
                if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    // 진행 중인 트랜잭션에 참여
                    return call(body);
                }

                // 스프링 트랜잭션의 물리 커넥션을 TxContext 에 꽂는다 (REQUIRES_NEW 면 바깥 것은 잠시 보관)
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    if (outer != null) TxContext.set(outer);
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    /** TransactionTemplate 이 롤백하도록 checked 예외를 잠시 감싸는 용도 */
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
