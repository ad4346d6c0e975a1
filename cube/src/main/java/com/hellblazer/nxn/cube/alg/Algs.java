/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.nxn.cube.alg;

import com.hellblazer.nxn.cube.model.Axis;
import com.hellblazer.nxn.cube.model.FaceName;
import com.hellblazer.nxn.cube.model.SliceName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Factories, notation and scrambles for {@link Alg}.
 * <p>
 * Notation: {@code U D F B L R} face turns, {@code M E S} slice turns with an optional 1-based index or range
 * ({@code M[2]}, {@code M[1:3]}), {@code X Y Z} whole cube rotations; a suffix of {@code '} inverts and {@code 2}
 * doubles.
 *
 * @author hal.hildebrand
 */
public final class Algs {

    public static final FaceAlg      U = new FaceAlg(FaceName.U, 1);
    public static final FaceAlg      D = new FaceAlg(FaceName.D, 1);
    public static final FaceAlg      F = new FaceAlg(FaceName.F, 1);
    public static final FaceAlg      B = new FaceAlg(FaceName.B, 1);
    public static final FaceAlg      L = new FaceAlg(FaceName.L, 1);
    public static final FaceAlg      R = new FaceAlg(FaceName.R, 1);
    public static final SliceAlg     M = SliceAlg.whole(SliceName.M, 1);
    public static final SliceAlg     E = SliceAlg.whole(SliceName.E, 1);
    public static final SliceAlg     S = SliceAlg.whole(SliceName.S, 1);
    public static final WholeCubeAlg X = new WholeCubeAlg(Axis.X, 1);
    public static final WholeCubeAlg Y = new WholeCubeAlg(Axis.Y, 1);
    public static final WholeCubeAlg Z = new WholeCubeAlg(Axis.Z, 1);
    public static final SeqAlg       NO_OP = new SeqAlg(List.of());

    private static final Pattern MOVE = Pattern.compile("([UDFBLRMESXYZxyz])(?:\\[(\\d+)(?::(\\d*))?])?(2'|2|')?");

    private Algs() {
    }

    public static FaceAlg face(FaceName face) {
        return new FaceAlg(face, 1);
    }

    public static SliceAlg slice(SliceName slice, int index) {
        return SliceAlg.single(slice, index, 1);
    }

    public static SliceAlg slice(SliceName slice, int from, int to) {
        return new SliceAlg(slice, from, to, 1);
    }

    public static WholeCubeAlg wholeCube(Axis axis) {
        return new WholeCubeAlg(axis, 1);
    }

    public static SeqAlg seq(Alg... algs) {
        return new SeqAlg(Arrays.asList(algs));
    }

    public static SeqAlg seq(List<? extends Alg> algs) {
        return new SeqAlg(new ArrayList<>(algs));
    }

    /**
     * @return quarter turns reduced to -1, 0, 1 or 2
     */
    public static int normalizeTurns(int n) {
        int turns = Math.floorMod(n, 4);
        return turns == 3 ? -1 : turns;
    }

    static String suffix(int n) {
        return switch (Math.floorMod(n, 4)) {
            case 0 -> "0";
            case 1 -> "";
            case 2 -> "2";
            default -> "'";
        };
    }

    /**
     * Parse an algorithm written in standard notation, moves separated by whitespace or written back to back.
     *
     * @throws IllegalArgumentException on unparsable text
     */
    public static SeqAlg parse(String text) {
        var moves = new ArrayList<Alg>();
        var remaining = text.strip();
        var matcher = MOVE.matcher(remaining);
        int position = 0;
        while (position < remaining.length()) {
            if (Character.isWhitespace(remaining.charAt(position))) {
                position++;
                continue;
            }
            matcher.region(position, remaining.length());
            if (!matcher.lookingAt()) {
                throw new IllegalArgumentException("Cannot parse '" + text + "' at position " + position);
            }
            moves.add(move(matcher.group(1).toUpperCase(), matcher.group(2), matcher.group(3), matcher.group(4)));
            position = matcher.end();
        }
        return new SeqAlg(moves);
    }

    private static Alg move(String name, String from, String to, String suffix) {
        int n = suffix == null ? 1 : switch (suffix) {
            case "'" -> -1;
            default -> 2;
        };
        return switch (name) {
            case "M", "E", "S" -> {
                var slice = SliceName.valueOf(name);
                if (from == null) {
                    yield SliceAlg.whole(slice, n);
                }
                int first = Integer.parseInt(from);
                int last = to == null ? first : to.isEmpty() ? SliceAlg.ALL : Integer.parseInt(to);
                yield new SliceAlg(slice, first, last, n);
            }
            case "X", "Y", "Z" -> {
                if (from != null) {
                    throw new IllegalArgumentException("Whole cube rotation " + name + " takes no index");
                }
                yield new WholeCubeAlg(Axis.valueOf(name), n);
            }
            default -> {
                if (from != null) {
                    throw new IllegalArgumentException("Face turn " + name + " takes no index");
                }
                yield new FaceAlg(FaceName.valueOf(name), n);
            }
        };
    }

    /**
     * Merge consecutive moves of the same face, slice range or axis and drop the moves that cancel out.
     */
    public static SeqAlg simplify(Alg alg) {
        var result = new ArrayList<Alg>();
        for (var move : alg.flatten()) {
            if (!result.isEmpty()) {
                var merged = merge(result.get(result.size() - 1), move);
                if (merged != null) {
                    result.remove(result.size() - 1);
                    if (normalizeTurns(turnsOf(merged)) != 0) {
                        result.add(merged);
                    }
                    continue;
                }
            }
            result.add(move);
        }
        return new SeqAlg(result);
    }

    private static Alg merge(Alg a, Alg b) {
        if (a instanceof FaceAlg fa && b instanceof FaceAlg fb && fa.face() == fb.face()) {
            return new FaceAlg(fa.face(), normalizeTurns(fa.n() + fb.n()));
        }
        if (a instanceof SliceAlg sa && b instanceof SliceAlg sb && sa.slice() == sb.slice()
        && sa.from() == sb.from() && sa.to() == sb.to()) {
            return new SliceAlg(sa.slice(), sa.from(), sa.to(), normalizeTurns(sa.n() + sb.n()));
        }
        if (a instanceof WholeCubeAlg wa && b instanceof WholeCubeAlg wb && wa.axis() == wb.axis()) {
            return new WholeCubeAlg(wa.axis(), normalizeTurns(wa.n() + wb.n()));
        }
        return null;
    }

    private static int turnsOf(Alg alg) {
        if (alg instanceof FaceAlg fa) {
            return fa.n();
        }
        if (alg instanceof SliceAlg sa) {
            return sa.n();
        }
        if (alg instanceof WholeCubeAlg wa) {
            return wa.n();
        }
        throw new IllegalArgumentException("Not an atomic move: " + alg);
    }

    /**
     * A reproducible random sequence of face and slice turns.
     *
     * @param cubeSize size of the cube the scramble is meant for; slice turns are used when it has inner layers
     * @param seed     random seed
     * @param length   number of moves
     */
    public static SeqAlg scramble(int cubeSize, long seed, int length) {
        var random = new Random(seed);
        var faces = FaceName.values();
        var moves = new ArrayList<Alg>(length);
        Object last = null;
        while (moves.size() < length) {
            int n = random.nextInt(3) + 1;
            if (cubeSize > 3 && random.nextInt(3) == 0) {
                var slice = SliceName.values()[random.nextInt(3)];
                int index = random.nextInt(cubeSize - 2) + 1;
                var key = slice.name() + index;
                if (key.equals(last)) {
                    continue;
                }
                last = key;
                moves.add(SliceAlg.single(slice, index, n));
            } else {
                var face = faces[random.nextInt(faces.length)];
                if (face == last) {
                    continue;
                }
                last = face;
                moves.add(new FaceAlg(face, n));
            }
        }
        return new SeqAlg(moves);
    }

    /**
     * @return a scramble long enough to mix a cube of the given size
     */
    public static SeqAlg scramble(int cubeSize, long seed) {
        return scramble(cubeSize, seed, Math.max(25, cubeSize * 12));
    }
}
