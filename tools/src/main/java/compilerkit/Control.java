/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package compilerkit;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Entry point for toolkit commands.
 */
public abstract class Control
{
    protected final PrintStream out;
    protected final PrintStream err;

    protected Control(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String args[]) {
        int status = new ToolkitControl().execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the command named by the first argument.
     *
     * @return the process exit status
     */
    public int execute(String[] args) {
        Method action = getActionMethod(getClass(), args);
        if (action == null) {
            err.println("invalid command. Use \"ctk help\" for more information");
            return 1;
        }

        Throwable failure = null;
        try {
            Object[] arguments = new Object[1];
            arguments[0] = Arrays.copyOfRange(args, 1, args.length);
            action.invoke(this, arguments);
        } catch (InvocationTargetException ex) {
            failure = ex.getCause();
        } catch (Exception ex) {
            failure = ex;
        }

        if (failure instanceof UsageException) {
            if (failure.getMessage() != null) {
                err.println(failure.getMessage());
            }
            return 1;
        }

        if (failure != null) {
            if (failure.getMessage() != null) {
                err.println("command failure: " + failure);
            } else {
                err.println("command failure");
                failure.printStackTrace(err);
            }
            return 2;
        }
        return 0;
    }

    private static Method getActionMethod(Class<? extends Control> cls, String[] args) {
        if (args.length == 0) {
            return null;
        }

        try {
            String command = args[0].replaceAll("-", "_");
            Method action = cls.getMethod(command, String[].class);
            return action.isAnnotationPresent(Command.class) ? action : null;
        } catch (NoSuchMethodException ex) {
            return null;
        }
    }

    @Command("Show this help message")
    @SuppressWarnings("unused")
    public void help(String[] args) {
        err.println("usage: ctk command [options] [args...]");
        err.println();
        err.println("COMMANDS:");
        err.println();
        Stream.of(this.getClass().getMethods())
              .filter(m -> m.isAnnotationPresent(Command.class))
              .sorted((a, b) -> a.getName().compareTo(b.getName()))
              .forEach(m -> err.printf("  %-10s%s%n", m.getName(), m.getAnnotation(Command.class).value()));
        err.println();
    }

    /**
     * Thrown by a command when its arguments are wrong. Reported without
     * the failure prefix and exits with status 1.
     */
    protected static class UsageException extends RuntimeException
    {
        private static final long serialVersionUID = 1L;

        public UsageException(String message) {
            super(message);
        }
    }
}
