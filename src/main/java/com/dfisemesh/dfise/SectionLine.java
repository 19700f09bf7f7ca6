package com.dfisemesh.dfise;

public record SectionLine(int number, String text) {
}
