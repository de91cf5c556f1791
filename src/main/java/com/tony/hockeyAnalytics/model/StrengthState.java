package com.tony.hockeyAnalytics.model;

/**
 * Nombre de patineurs de chaque côté, du point de vue de l'équipe qui tire.
 */
public record StrengthState(int skatersFor, int skatersAgainst) {

    public static final StrengthState EVEN = new StrengthState(5, 5);

    /**
     * Code de situation sur 4 chiffres : [gardien ext][patineurs ext][patineurs dom][gardien dom].
     * Code absent ou invalide : 5 contre 5.
     */
    public static StrengthState fromSituationCode(String situationCode, boolean home) {
        if (situationCode == null || situationCode.length() != 4 || !situationCode.chars().allMatch(Character::isDigit)) {
            return EVEN;
        }
        int awaySkaters = situationCode.charAt(1) - '0';
        int homeSkaters = situationCode.charAt(2) - '0';
        if (awaySkaters == 0 || homeSkaters == 0) return EVEN;
        return home ? new StrengthState(homeSkaters, awaySkaters) : new StrengthState(awaySkaters, homeSkaters);
    }

    public boolean isPowerPlay() {
        return skatersFor > skatersAgainst;
    }

    public String label() {
        return skatersFor + "v" + skatersAgainst;
    }
}
