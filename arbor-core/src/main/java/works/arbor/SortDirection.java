package works.arbor;

public enum SortDirection {
	ASC,
	DESC,
}
