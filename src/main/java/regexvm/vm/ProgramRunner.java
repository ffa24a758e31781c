package regexvm.vm;

/**
 * Executes a program by driving a {@link Backtracker}.
 *
 * <p>A runner repeatedly resumes pending threads from the backtracker and
 * steps through instructions until one thread accepts or every thread has
 * failed. Runners are stateless, so one runner can serve concurrent matches.
 */
public interface ProgramRunner {

  /**
   * Run until some thread accepts or no threads remain.
   *
   * @param backtracker state of the match attempt
   * @return whether a thread accepted
   */
  boolean run(Backtracker backtracker);
}
