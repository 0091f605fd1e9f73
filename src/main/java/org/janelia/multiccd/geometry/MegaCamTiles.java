package org.janelia.multiccd.geometry;

/**
 * Tile placement table of the CFHT MegaCam mosaic (North on top, East to the left).
 *
 * <pre>
 *        00 01 02 03 04 05 06 07 08        (flipped)
 *     36 09 10 11 12 13 14 15 16 17 37     (flipped)
 *     --------------*-----------------
 *     38 18 19 20 21 22 23 24 25 26 39
 *        27 28 29 30 31 32 33 34 35
 * </pre>
 *
 * The global origin lies at the corner shared by tiles 12, 13, 21 and 22 (marked with '*').
 * Tiles 36-39 are the "ear" tiles on both sides of the two middle rows.
 */
public final class MegaCamTiles
{
	public static final int NUM_TILES = 40;

	private static final TilePlacement[] PLACEMENTS = new TilePlacement[] {
			// first row
			new TilePlacement( -4,  1, true ),  //  0
			new TilePlacement( -3,  1, true ),  //  1
			new TilePlacement( -2,  1, true ),  //  2
			new TilePlacement( -1,  1, true ),  //  3
			new TilePlacement(  0,  1, true ),  //  4
			new TilePlacement(  1,  1, true ),  //  5
			new TilePlacement(  2,  1, true ),  //  6
			new TilePlacement(  3,  1, true ),  //  7
			new TilePlacement(  4,  1, true ),  //  8
			// second row
			new TilePlacement( -4,  0, true ),  //  9
			new TilePlacement( -3,  0, true ),  // 10
			new TilePlacement( -2,  0, true ),  // 11
			new TilePlacement( -1,  0, true ),  // 12
			new TilePlacement(  0,  0, true ),  // 13
			new TilePlacement(  1,  0, true ),  // 14
			new TilePlacement(  2,  0, true ),  // 15
			new TilePlacement(  3,  0, true ),  // 16
			new TilePlacement(  4,  0, true ),  // 17
			// third row
			new TilePlacement( -4, -1, false ), // 18
			new TilePlacement( -3, -1, false ), // 19
			new TilePlacement( -2, -1, false ), // 20
			new TilePlacement( -1, -1, false ), // 21
			new TilePlacement(  0, -1, false ), // 22
			new TilePlacement(  1, -1, false ), // 23
			new TilePlacement(  2, -1, false ), // 24
			new TilePlacement(  3, -1, false ), // 25
			new TilePlacement(  4, -1, false ), // 26
			// fourth row
			new TilePlacement( -4, -2, false ), // 27
			new TilePlacement( -3, -2, false ), // 28
			new TilePlacement( -2, -2, false ), // 29
			new TilePlacement( -1, -2, false ), // 30
			new TilePlacement(  0, -2, false ), // 31
			new TilePlacement(  1, -2, false ), // 32
			new TilePlacement(  2, -2, false ), // 33
			new TilePlacement(  3, -2, false ), // 34
			new TilePlacement(  4, -2, false ), // 35
			// ears
			new TilePlacement( -5,  0, true ),  // 36
			new TilePlacement(  5,  0, true ),  // 37
			new TilePlacement( -5, -1, false ), // 38
			new TilePlacement(  5, -1, false ), // 39
		};

	private MegaCamTiles() { }

	public static TilePlacement[] placements()
	{
		return PLACEMENTS.clone();
	}
}
