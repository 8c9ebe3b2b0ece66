package foldrun.coordinator.engine.lattice;

import java.util.Locale;

/**
 * Serializes a C-alpha chain as PDB text.
 */
public final class PdbWriter {

    private PdbWriter() {
    }

    public static String write(Chain chain, String protocol, double energy) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "REMARK   1 PROTOCOL %s\n", protocol));
        sb.append(String.format(Locale.ROOT, "REMARK   2 ENERGY %.4f\n", energy));
        for (int i = 0; i < chain.size(); i++) {
            double[] p = chain.position(i);
            sb.append(String.format(Locale.ROOT,
                    "ATOM  %5d  CA  %3s A%4d    %8.3f%8.3f%8.3f%6.2f%6.2f           C\n",
                    i + 1, chain.residue(i).name(), (i + 1) % 10000, p[0], p[1], p[2], 1.0, 0.0));
        }
        sb.append("TER\n");
        sb.append("END\n");
        return sb.toString();
    }
}
