package foldrun.coordinator.engine.lattice;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * One-letter residue codes mapped to PDB names and hydrophobicity,
 * loaded from a classpath properties file ({@code A=ALA,true}).
 */
public final class ResidueTable {

    private final Map<Character, Residue> residues;

    private ResidueTable(Map<Character, Residue> residues) {
        this.residues = Collections.unmodifiableMap(residues);
    }

    /**
     * Load the table from a classpath resource.
     *
     * @throws IOException              if the resource is missing or unreadable
     * @throws IllegalArgumentException if an entry is malformed
     */
    public static ResidueTable load(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream in = ResidueTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("residue table not found on classpath: " + resource);
            }
            props.load(in);
        }

        Map<Character, Residue> map = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.length() != 1) {
                throw new IllegalArgumentException("residue code must be one letter: " + key);
            }
            String[] parts = props.getProperty(key).split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("expected NAME,hydrophobic for residue " + key);
            }
            char code = Character.toUpperCase(key.charAt(0));
            map.put(code, new Residue(code, parts[0].trim().toUpperCase(Locale.ROOT),
                    Boolean.parseBoolean(parts[1].trim())));
        }
        if (map.isEmpty()) {
            throw new IllegalArgumentException("residue table " + resource + " is empty");
        }
        return new ResidueTable(map);
    }

    public int size() {
        return residues.size();
    }

    /**
     * Residues of a sequence. A sequence made only of H and P is read as the
     * hydrophobic-polar alphabet (H hydrophobic, P polar).
     *
     * @throws IllegalArgumentException for a letter missing from the table
     */
    public List<Residue> classify(String sequence) {
        String seq = sequence.toUpperCase(Locale.ROOT);
        boolean hpAlphabet = seq.chars().allMatch(c -> c == 'H' || c == 'P');

        List<Residue> out = new ArrayList<>(seq.length());
        for (int i = 0; i < seq.length(); i++) {
            char c = seq.charAt(i);
            Residue r = residues.get(c);
            if (r == null) {
                throw new IllegalArgumentException("unknown residue '" + c + "' at position " + (i + 1));
            }
            if (hpAlphabet) {
                r = new Residue(r.code(), r.name(), c == 'H');
            }
            out.add(r);
        }
        return out;
    }
}
