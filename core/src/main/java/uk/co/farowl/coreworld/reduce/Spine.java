// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Path.Move;
import uk.co.farowl.coreworld.term.Term;

/**
 * A term viewed as a head applied to a sequence of arguments:
 * {@code ((h a1) a2) ... an}. The head is never itself an application.
 *
 * @param head the term at the bottom of the function positions
 * @param arguments {@code a1} to {@code an}, in order of application
 */
public record Spine(Term head, List<Term> arguments) {

    /**
     * Unwind the application spine of a term.
     *
     * @param term to decompose
     * @return its head and arguments
     */
    public static Spine of(Term term) {
        List<Term> args = new ArrayList<>();
        Term head = term;
        while (head instanceof Application p) {
            args.add(p.argument());
            head = p.function();
        }
        Collections.reverse(args);
        return new Spine(head, Collections.unmodifiableList(args));
    }

    /**
     * Position, within the spine's term, of argument {@code i}.
     *
     * @param i argument number counting from 0
     * @return path from the root of the term to the argument
     */
    public Path argumentPath(int i) {
        return Path.ROOT.then(Move.FUNCTION, arguments.size() - 1 - i)
                .then(Move.ARGUMENT);
    }

    /** @return position of the head within the spine's term */
    public Path headPath() {
        return Path.ROOT.then(Move.FUNCTION, arguments.size());
    }

    /**
     * Re-apply a (new) head to arguments {@code from} onwards.
     *
     * @param newHead to put at the bottom of the spine
     * @param from first argument to apply
     * @return the rebuilt term
     */
    public Term rebuild(Term newHead, int from) {
        Term t = newHead;
        for (int i = from; i < arguments.size(); i++) {
            t = new Application(t, arguments.get(i));
        }
        return t;
    }
}
