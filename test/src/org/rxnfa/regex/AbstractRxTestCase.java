/* @LICENSE@  
 */

package org.rxnfa.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.rxnfa.regex.test");
    protected static final Level level = Level.FINEST; 
    
    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    } 

    public AbstractRxTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }
    
    /**
     * Logs the transition listing of an automaton at the test level.
     * @param nfa the automaton to dump
     * @return <code>nfa</code>, for chaining
     */
    protected static Nfa logged(Nfa nfa) {
        logger.log(level, nfa.toString());
        return nfa;
    }
}
