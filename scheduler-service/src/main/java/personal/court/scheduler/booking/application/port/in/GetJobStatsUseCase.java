package personal.court.scheduler.booking.application.port.in;

/**
 * Get Job Stats UseCase (Input Port)
 */
public interface GetJobStatsUseCase {

    JobStats getStats();
}
