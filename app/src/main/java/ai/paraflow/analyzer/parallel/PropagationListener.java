package ai.paraflow.analyzer.parallel;

/** Observes propagation; called on the propagating thread after each pass has been merged. */
@FunctionalInterface
public interface PropagationListener {

    void passCompleted(PassEvent event);

    PropagationListener NOOP = event -> {};
}
