package frontend.syntax;

import frontend.lexer.Position;
import frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 所有的语法树节点
 * 每个节点独占自己的子节点: 不共享, 无环. 优化器替换子节点时由父节点写回
 */
public class Ast {

    public enum NodeType {
        PROGRAM,
        PROMPT_DEF,
        VAR_DECL,
        TEMPLATE_DEF,
        CONSTRAINT_DEF,
        OUTPUT_SPEC,
        IDENTIFIER,
        STRING_LITERAL,
        NUMBER_LITERAL,
        BOOLEAN_LITERAL,
        BINARY_EXPR,
        UNARY_EXPR,
        VARIABLE_REF,
        TEMPLATE_CALL,
        FUNCTION_CALL,
        IF_STMT,
        FOR_STMT,
        WHILE_STMT,
        TEXT_ELEMENT,
        CONSTRAINT_EXPR,
        STATEMENT_LIST,
        EXPRESSION_LIST,
        ARGUMENT_LIST,
        CONSTRAINT_LIST,
        ELEMENT_LIST,
        EMPTY,
        ;

        public boolean isList() {
            return this == STATEMENT_LIST || this == EXPRESSION_LIST || this == ARGUMENT_LIST
                    || this == CONSTRAINT_LIST || this == ELEMENT_LIST;
        }

        public boolean isLiteral() {
            return this == STRING_LITERAL || this == NUMBER_LITERAL || this == BOOLEAN_LITERAL;
        }
    }

    // Node: the type tag decides which subclass it is
    public abstract static class Node {
        private final NodeType type;
        private final Position position;

        Node(NodeType type, Position position) {
            assert type != null;
            this.type = type;
            this.position = position == null ? Position.UNKNOWN : position;
        }

        public NodeType getType() {
            return type;
        }

        public Position getPosition() {
            return position;
        }

        // owned children in source order, absent optional slots skipped
        public abstract List<Node> children();

        @Override
        public String toString() {
            return type + "@" + position;
        }
    }

    // Program -> {Statement}
    public static class Program extends Node {
        private final ArrayList<Node> statements;

        public Program(ArrayList<Node> statements, Position position) {
            super(NodeType.PROGRAM, position);
            assert statements != null;
            this.statements = statements;
        }

        public ArrayList<Node> getStatements() {
            return statements;
        }

        @Override
        public List<Node> children() {
            return Collections.unmodifiableList(statements);
        }
    }

    // PromptDef -> 'PROMPT' Ident ElementBlock
    public static class PromptDef extends Node {
        private final String name;
        private ListNode body;

        public PromptDef(String name, ListNode body, Position position) {
            super(NodeType.PROMPT_DEF, position);
            assert name != null;
            assert body != null;
            this.name = name;
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public ListNode getBody() {
            return body;
        }

        public void setBody(ListNode body) {
            this.body = body;
        }

        @Override
        public List<Node> children() {
            return List.of(body);
        }
    }

    // VarDecl -> 'VAR' Ident ['=' Expr]
    public static class VarDecl extends Node {
        private final String name;
        private Node initializer; // nullable

        public VarDecl(String name, Node initializer, Position position) {
            super(NodeType.VAR_DECL, position);
            assert name != null;
            this.name = name;
            this.initializer = initializer;
        }

        public String getName() {
            return name;
        }

        public Node getInitializer() {
            return initializer;
        }

        public void setInitializer(Node initializer) {
            this.initializer = initializer;
        }

        @Override
        public List<Node> children() {
            return initializer == null ? List.of() : List.of(initializer);
        }
    }

    // TemplateDef -> 'TEMPLATE' Ident ['(' [Ident {',' Ident}] ')'] ElementBlock
    public static class TemplateDef extends Node {
        private final String name;
        private final ArrayList<String> parameters;
        private ListNode body;

        public TemplateDef(String name, ArrayList<String> parameters, ListNode body, Position position) {
            super(NodeType.TEMPLATE_DEF, position);
            assert name != null;
            assert parameters != null;
            assert body != null;
            this.name = name;
            this.parameters = parameters;
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public ArrayList<String> getParameters() {
            return parameters;
        }

        public ListNode getBody() {
            return body;
        }

        public void setBody(ListNode body) {
            this.body = body;
        }

        @Override
        public List<Node> children() {
            return List.of(body);
        }
    }

    // ConstraintDef -> 'CONSTRAINT' Ident '{' {ConstraintExpr} '}'
    public static class ConstraintDef extends Node {
        private final String name;
        private final ListNode constraints;

        public ConstraintDef(String name, ListNode constraints, Position position) {
            super(NodeType.CONSTRAINT_DEF, position);
            assert name != null;
            assert constraints != null && constraints.getType() == NodeType.CONSTRAINT_LIST;
            this.name = name;
            this.constraints = constraints;
        }

        public String getName() {
            return name;
        }

        public ListNode getConstraints() {
            return constraints;
        }

        @Override
        public List<Node> children() {
            return List.of(constraints);
        }
    }

    // OutputSpec -> 'OUTPUT' Ident ['AS' Ident]
    public static class OutputSpec extends Node {
        private final String name;
        private final String format; // nullable, validated by the analyzer

        public OutputSpec(String name, String format, Position position) {
            super(NodeType.OUTPUT_SPEC, position);
            assert name != null;
            this.name = name;
            this.format = format;
        }

        public String getName() {
            return name;
        }

        public String getFormat() {
            return format;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static class Identifier extends Node {
        private final String name;

        public Identifier(String name, Position position) {
            super(NodeType.IDENTIFIER, position);
            assert name != null;
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static class StringLiteral extends Node {
        private final String value;

        public StringLiteral(String value, Position position) {
            super(NodeType.STRING_LITERAL, position);
            assert value != null;
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static class NumberLiteral extends Node {
        private final double value;

        public NumberLiteral(double value, Position position) {
            super(NodeType.NUMBER_LITERAL, position);
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        // integral values print without a fraction: 14 rather than 14.0
        public static String format(double value) {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return "number " + format(value);
        }
    }

    public static class BooleanLiteral extends Node {
        private final boolean value;

        public BooleanLiteral(boolean value, Position position) {
            super(NodeType.BOOLEAN_LITERAL, position);
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    // BinaryExp -> Exp Op Exp, one operator per node
    public static class BinaryExpr extends Node {
        private final TokenType operator;
        private Node left;
        private Node right;

        public BinaryExpr(TokenType operator, Node left, Node right, Position position) {
            super(NodeType.BINARY_EXPR, position);
            assert operator != null;
            assert left != null;
            assert right != null;
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public TokenType getOperator() {
            return operator;
        }

        public Node getLeft() {
            return left;
        }

        public Node getRight() {
            return right;
        }

        public void setLeft(Node left) {
            assert left != null;
            this.left = left;
        }

        public void setRight(Node right) {
            assert right != null;
            this.right = right;
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    // UnaryExp -> ('-' | 'NOT') Exp
    public static class UnaryExpr extends Node {
        private final TokenType operator;
        private Node operand;

        public UnaryExpr(TokenType operator, Node operand, Position position) {
            super(NodeType.UNARY_EXPR, position);
            assert operator != null;
            assert operand != null;
            this.operator = operator;
            this.operand = operand;
        }

        public TokenType getOperator() {
            return operator;
        }

        public Node getOperand() {
            return operand;
        }

        public void setOperand(Node operand) {
            assert operand != null;
            this.operand = operand;
        }

        @Override
        public List<Node> children() {
            return List.of(operand);
        }
    }

    // '$' Ident
    public static class VariableRef extends Node {
        private final String name;

        public VariableRef(String name, Position position) {
            super(NodeType.VARIABLE_REF, position);
            assert name != null;
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    // Call -> '@' Ident [Args] (TEMPLATE_CALL) | Ident Args (FUNCTION_CALL)
    public static class Call extends Node {
        private final String name;
        private final ListNode arguments;

        public Call(NodeType type, String name, ListNode arguments, Position position) {
            super(type, position);
            assert type == NodeType.TEMPLATE_CALL || type == NodeType.FUNCTION_CALL;
            assert name != null;
            assert arguments != null && arguments.getType() == NodeType.ARGUMENT_LIST;
            this.name = name;
            this.arguments = arguments;
        }

        public String getName() {
            return name;
        }

        public ListNode getArguments() {
            return arguments;
        }

        @Override
        public List<Node> children() {
            return List.of(arguments);
        }
    }

    // IfStmt -> 'IF' Exp Block ['ELSE' (IfStmt | Block)]
    public static class IfStmt extends Node {
        private Node condition;
        private Node thenBranch;
        private Node elseBranch; // nullable

        public IfStmt(Node condition, Node thenBranch, Node elseBranch, Position position) {
            super(NodeType.IF_STMT, position);
            assert condition != null;
            assert thenBranch != null;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public Node getCondition() {
            return condition;
        }

        public Node getThenBranch() {
            return thenBranch;
        }

        public Node getElseBranch() {
            return elseBranch;
        }

        public void setCondition(Node condition) {
            assert condition != null;
            this.condition = condition;
        }

        public void setThenBranch(Node thenBranch) {
            this.thenBranch = thenBranch;
        }

        public void setElseBranch(Node elseBranch) {
            this.elseBranch = elseBranch;
        }

        @Override
        public List<Node> children() {
            ArrayList<Node> list = new ArrayList<>();
            list.add(condition);
            if (thenBranch != null) list.add(thenBranch);
            if (elseBranch != null) list.add(elseBranch);
            return list;
        }
    }

    // ForStmt -> 'FOR' Ident 'IN' Exp Block
    public static class ForStmt extends Node {
        private final String variable;
        private final Node iterable;
        private final Node body;

        public ForStmt(String variable, Node iterable, Node body, Position position) {
            super(NodeType.FOR_STMT, position);
            assert variable != null;
            assert iterable != null;
            assert body != null;
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
        }

        public String getVariable() {
            return variable;
        }

        public Node getIterable() {
            return iterable;
        }

        public Node getBody() {
            return body;
        }

        @Override
        public List<Node> children() {
            return List.of(iterable, body);
        }
    }

    // WhileStmt -> 'WHILE' Exp Block
    public static class WhileStmt extends Node {
        private final Node condition;
        private final Node body;

        public WhileStmt(Node condition, Node body, Position position) {
            super(NodeType.WHILE_STMT, position);
            assert condition != null;
            assert body != null;
            this.condition = condition;
            this.body = body;
        }

        public Node getCondition() {
            return condition;
        }

        public Node getBody() {
            return body;
        }

        @Override
        public List<Node> children() {
            return List.of(condition, body);
        }
    }

    // TextElement -> ['RAW'] String
    public static class TextElement extends Node {
        private final String text;
        private final boolean raw;

        public TextElement(String text, boolean raw, Position position) {
            super(NodeType.TEXT_ELEMENT, position);
            assert text != null;
            this.text = text;
            this.raw = raw;
        }

        public String getText() {
            return text;
        }

        public boolean isRaw() {
            return raw;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    // ConstraintExpr -> (Ident | '$' Ident) CmpOp Exp
    public static class ConstraintExpr extends Node {
        private final String variable;
        private final TokenType operator; // comparison, IN, or NOT for "NOT IN"
        private Node value;

        public ConstraintExpr(String variable, TokenType operator, Node value, Position position) {
            super(NodeType.CONSTRAINT_EXPR, position);
            assert variable != null;
            assert operator != null;
            assert value != null;
            this.variable = variable;
            this.operator = operator;
            this.value = value;
        }

        public String getVariable() {
            return variable;
        }

        public TokenType getOperator() {
            return operator;
        }

        public Node getValue() {
            return value;
        }

        public void setValue(Node value) {
            assert value != null;
            this.value = value;
        }

        // NOT is stored for "NOT IN"
        public String getOperatorText() {
            return switch (operator) {
                case IN -> "IN";
                case NOT -> "NOT IN";
                default -> operator.getText();
            };
        }

        @Override
        public List<Node> children() {
            return List.of(value);
        }
    }

    // the five list kinds share one class, order is significant
    public static class ListNode extends Node {
        private final ArrayList<Node> elements;

        public ListNode(NodeType type, ArrayList<Node> elements, Position position) {
            super(type, position);
            assert type.isList();
            assert elements != null;
            this.elements = elements;
        }

        public ArrayList<Node> getElements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        @Override
        public List<Node> children() {
            return Collections.unmodifiableList(elements);
        }
    }

    public static class Empty extends Node {
        public Empty(Position position) {
            super(NodeType.EMPTY, position);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * 检查单一所有权: 任何节点只能从根经过唯一路径到达
     */
    public static boolean isTree(Node root) {
        if (root == null) {
            return true;
        }
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        ArrayList<Node> stack = new ArrayList<>();
        stack.add(root);
        while (!stack.isEmpty()) {
            Node node = stack.remove(stack.size() - 1);
            if (!seen.add(node)) {
                return false;
            }
            stack.addAll(node.children());
        }
        return true;
    }

    // node count of a subtree, root included
    public static int count(Node root) {
        if (root == null) {
            return 0;
        }
        int n = 1;
        for (Node child : root.children()) {
            n += count(child);
        }
        return n;
    }
}
