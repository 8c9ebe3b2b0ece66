package foldrun.coordinator.engine.lattice;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResidueTableTest {

    private static ResidueTable table;

    @BeforeAll
    static void load() throws IOException {
        table = ResidueTable.load("foldrun/engine/residues.properties");
    }

    @Test
    void loadsTwentyAminoAcids() {
        assertEquals(20, table.size());
    }

    @Test
    void classifiesStandardSequence() {
        List<Residue> residues = table.classify("aLk");

        assertEquals(3, residues.size());
        assertEquals("ALA", residues.get(0).name());
        assertTrue(residues.get(1).hydrophobic());
        assertFalse(residues.get(2).hydrophobic());
    }

    @Test
    void hpSequenceUsesHydrophobicPolarAlphabet() {
        List<Residue> residues = table.classify("HPPH");

        assertTrue(residues.get(0).hydrophobic());
        assertFalse(residues.get(1).hydrophobic());
        assertFalse(residues.get(2).hydrophobic());
        assertTrue(residues.get(3).hydrophobic());
    }

    @Test
    void unknownLetterRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> table.classify("AAB"));
        assertTrue(e.getMessage().contains("position 3"));
    }

    @Test
    void missingResourceFailsLoad() {
        assertThrows(IOException.class, () -> ResidueTable.load("foldrun/engine/none.properties"));
    }
}
