package org.nowstart.rampart.data.type;

public enum Direction {
    LONG(1),
    SHORT(-1);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }
}
