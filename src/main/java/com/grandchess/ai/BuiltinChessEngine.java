package com.grandchess.ai;

import com.grandchess.model.Move;
import com.grandchess.model.PieceColor;
import com.grandchess.model.Position;

import java.util.Random;

public final class BuiltinChessEngine implements ChessEngine {
    private final Random random;

    public BuiltinChessEngine() {
        this(new Random());
    }

    public BuiltinChessEngine(Random random) {
        this.random = random;
    }

    @Override
    public Move findBestMove(Position position, PieceColor aiColor, MinimaxAI.Difficulty difficulty) {
        MinimaxAI ai = new MinimaxAI(random);
        ai.setDifficulty(difficulty);
        return ai.findBestMove(position, aiColor);
    }

    @Override
    public String getEngineId() {
        return "builtin";
    }

    @Override
    public String getEngineText() {
        return "Built-in minimax";
    }
}
