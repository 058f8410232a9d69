package com.typepulse.processing.keyboard;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Finger {
    LEFT_PINKY("Left Pinky", Hand.LEFT),
    LEFT_RING("Left Ring", Hand.LEFT),
    LEFT_MIDDLE("Left Middle", Hand.LEFT),
    LEFT_INDEX("Left Index", Hand.LEFT),
    LEFT_THUMB("Left Thumb", Hand.LEFT),
    RIGHT_INDEX("Right Index", Hand.RIGHT),
    RIGHT_MIDDLE("Right Middle", Hand.RIGHT),
    RIGHT_RING("Right Ring", Hand.RIGHT),
    RIGHT_PINKY("Right Pinky", Hand.RIGHT),
    RIGHT_THUMB("Right Thumb", Hand.RIGHT),
    THUMBS("Thumbs", Hand.BOTH);

    private final String label;
    private final Hand hand;

    Finger(String label, Hand hand) {
        this.label = label;
        this.hand = hand;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Hand hand() {
        return hand;
    }
}
