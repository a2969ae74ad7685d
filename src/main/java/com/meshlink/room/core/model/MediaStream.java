package com.meshlink.room.core.model;

/**
 * Yakalanmış ya da uzaktan gelen bir medya akışı. Yakalama/çizim bu katmanın işi değil;
 * oda yalnızca tutamacı taşır.
 */
public interface MediaStream {
    String getId();
}
