package org.mark.loracard.lora;

import java.io.File;
import java.util.ArrayList;
import java.util.List;



public class LoraModel {

	/**
	 * 	Base model value as written by some trainers.
	 */
	private static final String SDXL_LONG_NAME = "SDXL 1.0";

	/**
	 * 	Declared model id (Civitai model id for downloaded files).
	 */
	private String modelId = "";

	/**
	 * 	Declared base model, e.g. "Wan Video 2.2" or "SDXL".
	 */
	private String diffusionBaseModel = "";

	/**
	 * 	Declared version name.
	 */
	private String modelVersionName = "";

	/**
	 * 	Name of the model file on disk.
	 */
	private String safeTensorFileName = "";

	/**
	 *
	 */
	private String modelType = "";

	/**
	 *
	 */
	private String sha256Hash = "";

	/**
	 *
	 */
	private List<String> tags = new ArrayList<>();

	/**
	 * 	The model file plus its sidecar files (previews, info json...).
	 */
	private transient List<File> associatedFiles = new ArrayList<>();

	/**
	 * 	No sidecar metadata was found or it could not be read.
	 */
	private boolean noMetaData = true;


	public LoraModel() {

	}

	public LoraModel(String safeTensorFileName) {
		this.setSafeTensorFileName(safeTensorFileName);
	}

	public String getModelId() {
		return this.modelId;
	}

	public void setModelId(String modelId) {
		this.modelId = modelId == null ? "" : modelId;
	}

	public String getDiffusionBaseModel() {
		return this.diffusionBaseModel;
	}

	public void setDiffusionBaseModel(String diffusionBaseModel) {
		if (diffusionBaseModel == null) {
			this.diffusionBaseModel = "";
			return;
		}
		this.diffusionBaseModel = SDXL_LONG_NAME.equals(diffusionBaseModel) ? "SDXL" : diffusionBaseModel;
	}

	public String getModelVersionName() {
		return this.modelVersionName;
	}

	public void setModelVersionName(String modelVersionName) {
		this.modelVersionName = modelVersionName == null ? "" : modelVersionName;
	}

	public String getSafeTensorFileName() {
		return this.safeTensorFileName;
	}

	public void setSafeTensorFileName(String safeTensorFileName) {
		this.safeTensorFileName = safeTensorFileName == null ? "" : safeTensorFileName;
	}

	public String getModelType() {
		return this.modelType;
	}

	public void setModelType(String modelType) {
		this.modelType = modelType == null ? "" : modelType;
	}

	public String getSha256Hash() {
		return this.sha256Hash;
	}

	public void setSha256Hash(String sha256Hash) {
		this.sha256Hash = sha256Hash == null ? "" : sha256Hash;
	}

	public List<String> getTags() {
		return this.tags;
	}

	public void setTags(List<String> tags) {
		this.tags = tags == null ? new ArrayList<>() : tags;
	}

	public List<File> getAssociatedFiles() {
		return this.associatedFiles;
	}

	public void setAssociatedFiles(List<File> associatedFiles) {
		this.associatedFiles = associatedFiles == null ? new ArrayList<>() : associatedFiles;
	}

	public boolean isNoMetaData() {
		return this.noMetaData;
	}

	public void setNoMetaData(boolean noMetaData) {
		this.noMetaData = noMetaData;
	}

	/**
	 * 	True when at least one of the declared identity fields is filled.
	 * @return
	 */
	public boolean hasAnyMetadata() {
		return !this.modelId.isBlank() || !this.diffusionBaseModel.isBlank() || !this.modelVersionName.isBlank()
				|| !this.modelType.isBlank() || !this.tags.isEmpty();
	}

	/**
	 * 	Name shown on a card: the version name when declared, otherwise the file name.
	 * @return
	 */
	public String getDisplayName() {
		return this.modelVersionName.isBlank() ? this.safeTensorFileName : this.modelVersionName;
	}

	@Override
	public String toString() {
		return "LoraModel{" + "file='" + safeTensorFileName + '\'' + ", modelId='" + modelId + '\'' + ", baseModel='"
				+ diffusionBaseModel + '\'' + ", version='" + modelVersionName + '\'' + '}';
	}
}
