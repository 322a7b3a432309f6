package translate;

import translate.builder.InstructionBuilder;

public record InstructionInfo(String name, InstructionBuilder builder) {
}
