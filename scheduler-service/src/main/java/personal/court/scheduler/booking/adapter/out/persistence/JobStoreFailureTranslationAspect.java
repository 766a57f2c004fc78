package personal.court.scheduler.booking.adapter.out.persistence;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import personal.court.scheduler.booking.domain.exception.JobStoreUnavailableException;

/**
 * Job Store Failure Translation Aspect
 *
 * JobPersistenceAdapter 호출 중 연결/트랜잭션 단계의 장애를 JobStoreUnavailableException으로 바꾼다.
 * 트랜잭션 프록시보다 바깥에서 실행되어야 트랜잭션 시작 실패까지 잡을 수 있다.
 * 제약 위반, 상태 충돌 등 요청 단위 오류는 그대로 통과시킨다.
 */
@Slf4j
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class JobStoreFailureTranslationAspect {

    @Around("within(personal.court.scheduler.booking.adapter.out.persistence.JobPersistenceAdapter)")
    public Object translateStoreFailure(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException
                 | RecoverableDataAccessException | CannotCreateTransactionException e) {
            String method = joinPoint.getSignature().toShortString();
            log.error("Job store unavailable: method={}, errorType={}, error={}",
                    method, e.getClass().getSimpleName(), e.getMessage());
            throw new JobStoreUnavailableException("Job store unavailable during " + method, e);
        }
    }
}
