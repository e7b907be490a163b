package minipy;

/** Binary operators. Arithmetic and comparison share {@link Expr.BinOp}. */
enum Operator {
    PLUS("+"), MINUS("-"), TIMES("*"), DIVIDE("/"),
    GREATER(">"), LESS("<"), GREATER_EQUAL(">="), LESS_EQUAL("<="), EQUAL("=="), NOT_EQUAL("!=");

    final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    static Operator of(TokenType type) {
        switch (type) {
            case PLUS: return PLUS;
            case MINUS: return MINUS;
            case STAR: return TIMES;
            case SLASH: return DIVIDE;
            case GREATER: return GREATER;
            case LESS: return LESS;
            case GREATER_EQUAL: return GREATER_EQUAL;
            case LESS_EQUAL: return LESS_EQUAL;
            case EQUAL_EQUAL: return EQUAL;
            case BANG_EQUAL: return NOT_EQUAL;
            default:
                throw new IllegalArgumentException("Not an operator: " + type);
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
