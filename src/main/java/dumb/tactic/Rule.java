package dumb.tactic;

import java.util.List;

/**
 * A kernel inference rule: reduces one goal to zero or more premises.
 */
public interface Rule {

    String name();

    /**
     * @return the premises, in order; empty if the rule closes the goal
     * @throws InapplicableException if the goal does not have the shape the rule requires
     */
    List<Sequent> apply(Sequent goal);

    class InapplicableException extends RuntimeException {
        public InapplicableException(String msg) {
            super(msg);
        }
    }
}
