package personal.court.scheduler.booking.application.port.in;

/**
 * Execute Job UseCase (Input Port)
 * 트리거된 작업 1건에 대해 정확히 한 번의 시도 사이클을 수행
 */
public interface ExecuteJobUseCase {

    ExecutionOutcome execute(Long jobId);
}
