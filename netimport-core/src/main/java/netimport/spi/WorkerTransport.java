package netimport.spi;

import java.time.Duration;
import java.util.List;

/**
 * Broker between the dispatching process and worker processes.
 *
 * <p>The dispatch side only enqueues job ids and asks which workers are alive. Workers
 * register themselves, heart-beat, claim tasks and acknowledge them once handled.
 * A claimed task that is never acknowledged becomes claimable again after its lock
 * expires, so delivery is at-least-once; the runner's QUEUED guard keeps a job from
 * running twice.
 */
public interface WorkerTransport {

  /**
   * Enqueues a job for execution by some worker.
   *
   * @param jobId the job to run
   * @return a transport task reference
   * @throws RuntimeException if the broker rejects or cannot accept the task
   */
  String enqueue(String jobId);

  /**
   * Lists workers that reported liveness recently. Must return within roughly
   * {@code timeout}; callers still bound the call themselves.
   *
   * @param timeout how long the broker may take to answer
   * @return ids of live workers, possibly empty
   * @throws RuntimeException if the broker is unreachable
   */
  List<String> ping(Duration timeout);

  /**
   * Registers a worker, or refreshes it if already known.
   *
   * @param workerId the worker id
   */
  void register(String workerId);

  /**
   * Marks a worker alive now.
   *
   * @param workerId the worker id
   */
  void heartbeat(String workerId);

  /**
   * Removes a worker from the registry.
   *
   * @param workerId the worker id
   */
  void deregister(String workerId);

  /**
   * Claims up to {@code limit} tasks for {@code workerId}. Tasks claimed by another
   * worker longer ago than {@code lockTimeout} may be reclaimed.
   *
   * @param workerId    the claiming worker
   * @param lockTimeout claim lifetime
   * @param limit       maximum tasks returned
   * @return claimed tasks, oldest first
   */
  List<ClaimedTask> claim(String workerId, Duration lockTimeout, int limit);

  /**
   * Removes a handled task.
   *
   * @param taskRef the task reference
   */
  void acknowledge(String taskRef);
}
