package personal.court.scheduler.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.court.scheduler.booking.application.port.in.CancelJobUseCase;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort;
import personal.court.scheduler.booking.domain.model.Job;

/**
 * Job Cancel Service
 * 저장소에서 먼저 취소한 뒤 스케줄러의 대기 트리거를 제거
 * 이미 실행 중인 작업은 결과 기록 시 compare-and-set이 충돌하므로 취소가 유지된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCancelService implements CancelJobUseCase {

    private final JobRepository jobRepository;
    private final TriggerSchedulerPort triggerSchedulerPort;

    @Override
    public Job cancel(Long jobId) {
        Job cancelled = jobRepository.cancel(jobId);
        triggerSchedulerPort.disarm(jobId);
        log.info("Job cancelled: jobId={}, desiredTime={}", jobId, cancelled.desiredTime());
        return cancelled;
    }
}
