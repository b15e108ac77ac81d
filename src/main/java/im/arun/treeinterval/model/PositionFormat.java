package im.arun.treeinterval.model;

/**
 * Text layouts for {@link Position#positionAs(PositionFormat)}.
 */
public enum PositionFormat {
    DEFAULT,
    POSITION,
    TUPLE
}
