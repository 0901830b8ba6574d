package com.rift.coordinator;

import com.rift.parser.AstNode;
import com.rift.parser.BinaryOpNode;
import com.rift.parser.NumberNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Folds binary operations whose operands are both numeric literals.
 * <p>
 * Works bottom-up, so a constant subtree of any depth collapses in one application
 * and a second application changes nothing. Division by zero and literals that do
 * not parse as decimals are left unfolded.
 */
public class ConstantFoldingPass implements OptimizationPass {

    public static final String NAME = "constant_folding";

    private static final Logger log = LoggerFactory.getLogger(ConstantFoldingPass.class);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AstNode apply(AstNode root) {
        if (!(root instanceof BinaryOpNode binary)) {
            return root;
        }

        AstNode left = apply(binary.left());
        AstNode right = apply(binary.right());

        if (left instanceof NumberNode l && right instanceof NumberNode r) {
            Optional<String> folded = fold(binary.operator(), l.text(), r.text());
            if (folded.isPresent()) {
                log.debug("Folded ({} {} {}) -> {}", l.text(), binary.operator(), r.text(), folded.get());
                return new NumberNode(folded.get());
            }
        }

        if (left == binary.left() && right == binary.right()) {
            return binary;
        }
        return new BinaryOpNode(binary.operator(), left, right);
    }

    private Optional<String> fold(String operator, String leftText, String rightText) {
        BigDecimal left;
        BigDecimal right;
        try {
            left = new BigDecimal(leftText);
            right = new BigDecimal(rightText);
        } catch (NumberFormatException e) {
            log.debug("Skipping fold of non-decimal literals '{}' {} '{}'", leftText, operator, rightText);
            return Optional.empty();
        }

        BigDecimal result = switch (operator) {
            case "+" -> left.add(right);
            case "-" -> left.subtract(right);
            case "*" -> left.multiply(right);
            case "/" -> right.signum() == 0 ? null : divide(left, right);
            default -> null;
        };

        if (result == null) {
            return Optional.empty();
        }
        return Optional.of(format(result));
    }

    /**
     * Exact quotient when one exists, otherwise rounded to {@link MathContext#DECIMAL64}.
     */
    private static BigDecimal divide(BigDecimal left, BigDecimal right) {
        try {
            return left.divide(right);
        } catch (ArithmeticException e) {
            return left.divide(right, MathContext.DECIMAL64);
        }
    }

    private static String format(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
