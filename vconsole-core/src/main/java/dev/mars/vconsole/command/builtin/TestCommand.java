/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.vconsole.command.builtin;

import dev.mars.vconsole.command.BaseCommand;
import dev.mars.vconsole.command.CommandContext;
import dev.mars.vconsole.command.ExitCode;
import dev.mars.vconsole.vfs.INode;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * {@code test EXPRESSION}: evaluates a file, string or integer condition and
 * reports it through the exit status, 0 for true and 1 for false. A malformed
 * expression exits with 2.
 *
 * <p>One operand tests for a non-empty string, two operands apply a unary
 * operator and three a binary one. A leading {@code !} negates the rest.
 * File operands are resolved against the working directory; a file that
 * does not exist makes every file test false.</p>
 */
public final class TestCommand extends BaseCommand {

    public TestCommand() {
        super("test", "Evaluate a conditional expression", "test EXPRESSION");
    }

    @Override
    protected boolean acceptsHelpFlag() {
        // -h is the symbolic link test
        return false;
    }

    @Override
    protected Future<Integer> run(CommandContext context, ParsedArgs ignored) {
        List<String> args = context.getArgs();
        if (args.size() == 1 && "--help".equals(args.get(0))) {
            context.out(helpText());
            return Future.succeededFuture(ExitCode.SUCCESS);
        }
        boolean negate = !args.isEmpty() && "!".equals(args.get(0)) && args.size() > 1;
        List<String> expression = negate ? args.subList(1, args.size()) : args;

        Future<Boolean> result;
        try {
            result = evaluate(context, expression);
        } catch (IllegalArgumentException e) {
            return Future.succeededFuture(usageError(context, e.getMessage()));
        }
        return result.map(value -> value != negate ? ExitCode.SUCCESS : ExitCode.ERROR);
    }

    private Future<Boolean> evaluate(CommandContext context, List<String> expression) {
        return switch (expression.size()) {
            case 0 -> Future.succeededFuture(false);
            case 1 -> Future.succeededFuture(!expression.get(0).isEmpty());
            case 2 -> unary(context, expression.get(0), expression.get(1));
            case 3 -> binary(context, expression.get(0), expression.get(1), expression.get(2));
            default -> throw new IllegalArgumentException("too many arguments");
        };
    }

    private Future<Boolean> unary(CommandContext context, String operator, String operand) {
        return switch (operator) {
            case "-e" -> file(context, operand, node -> true);
            case "-f" -> file(context, operand, INode::isFile);
            case "-d" -> file(context, operand, INode::isDirectory);
            case "-s" -> file(context, operand, node -> node.size() > 0);
            case "-r" -> file(context, operand, node -> (node.mode() & 0444) != 0);
            case "-w" -> file(context, operand, node -> (node.mode() & 0222) != 0);
            case "-x" -> file(context, operand, node -> (node.mode() & 0111) != 0);
            case "-L", "-h" -> link(context, operand).map(node -> node.map(INode::isSymlink).orElse(false));
            case "-z" -> Future.succeededFuture(operand.isEmpty());
            case "-n" -> Future.succeededFuture(!operand.isEmpty());
            default -> throw new IllegalArgumentException("unknown unary operator: " + operator);
        };
    }

    private Future<Boolean> binary(CommandContext context, String left, String operator, String right) {
        return switch (operator) {
            case "=", "==" -> Future.succeededFuture(left.equals(right));
            case "!=" -> Future.succeededFuture(!left.equals(right));
            case "-eq" -> Future.succeededFuture(integer(left) == integer(right));
            case "-ne" -> Future.succeededFuture(integer(left) != integer(right));
            case "-lt" -> Future.succeededFuture(integer(left) < integer(right));
            case "-le" -> Future.succeededFuture(integer(left) <= integer(right));
            case "-gt" -> Future.succeededFuture(integer(left) > integer(right));
            case "-ge" -> Future.succeededFuture(integer(left) >= integer(right));
            case "-nt" -> files(context, left, right, (a, b) -> a.modifiedAt().isAfter(b.modifiedAt()));
            case "-ot" -> files(context, left, right, (a, b) -> a.modifiedAt().isBefore(b.modifiedAt()));
            case "-ef" -> files(context, left, right, (a, b) -> a.inode() == b.inode());
            default -> throw new IllegalArgumentException("unknown binary operator: " + operator);
        };
    }

    private static long integer(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("integer expression expected: " + value);
        }
    }

    private Future<Boolean> file(CommandContext context, String operand, Predicate<INode> test) {
        return stat(context, operand).map(node -> node.map(test::test).orElse(false));
    }

    private Future<Boolean> files(CommandContext context, String left, String right,
                                  BiPredicate<INode, INode> test) {
        return stat(context, left).compose(a -> stat(context, right).map(b ->
                a.isPresent() && b.isPresent() && test.test(a.get(), b.get())));
    }

    private static Future<Optional<INode>> stat(CommandContext context, String operand) {
        if (operand.isEmpty()) {
            return Future.succeededFuture(Optional.empty());
        }
        return context.getVfs().stat(context.resolvePath(operand))
                .map(Optional::of)
                .otherwise(err -> Optional.empty());
    }

    private static Future<Optional<INode>> link(CommandContext context, String operand) {
        if (operand.isEmpty()) {
            return Future.succeededFuture(Optional.empty());
        }
        return context.getVfs().lstat(context.resolvePath(operand))
                .map(Optional::of)
                .otherwise(err -> Optional.empty());
    }
}
